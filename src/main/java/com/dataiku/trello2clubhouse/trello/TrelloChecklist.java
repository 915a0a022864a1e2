package com.dataiku.trello2clubhouse.trello;

import java.util.ArrayList;
import java.util.List;

public class TrelloChecklist {

    private String id;
    private String name;
    private Double pos;
    private List<CheckItem> checkItems;

    public TrelloChecklist() {
    }

    public TrelloChecklist(String name, Double pos, List<CheckItem> checkItems) {
        this.name = name;
        this.pos = pos;
        this.checkItems = checkItems;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Double getPos() {
        return pos;
    }

    public List<CheckItem> getCheckItems() {
        return checkItems == null ? new ArrayList<>() : checkItems;
    }

    public static class CheckItem {
        public static final String STATE_COMPLETE = "complete";

        private String id;
        private String name;
        private String state;
        private Double pos;

        public CheckItem() {
        }

        public CheckItem(String name, String state, Double pos) {
            this.name = name;
            this.state = state;
            this.pos = pos;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getState() {
            return state;
        }

        public Double getPos() {
            return pos;
        }
    }
}
