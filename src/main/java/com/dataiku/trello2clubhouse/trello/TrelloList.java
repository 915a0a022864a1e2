package com.dataiku.trello2clubhouse.trello;

public class TrelloList {

    private String id;
    private String name;
    private boolean closed;

    public TrelloList() {
    }

    public TrelloList(String id, String name) {
        this.id = id;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public boolean isClosed() {
        return closed;
    }
}
