package com.dataiku.trello2clubhouse.trello;

import java.util.ArrayList;
import java.util.List;

/**
 * Card as returned by {@code GET /1/boards/{id}/cards}.
 */
public class TrelloCard {

    private String id;
    private String name;
    private String desc;
    private String due;
    private String idBoard;
    private String idList;
    private List<String> idMembers;
    private List<Label> labels;
    private double pos;
    private String shortUrl;
    private String url;
    private boolean closed;

    public TrelloCard() {
    }

    public TrelloCard(String id, String idList, String name) {
        this.id = id;
        this.idList = idList;
        this.name = name;
    }

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDesc() {
        return desc;
    }

    public void setDesc(String desc) {
        this.desc = desc;
    }

    public String getDue() {
        return due;
    }

    public void setDue(String due) {
        this.due = due;
    }

    public String getIdBoard() {
        return idBoard;
    }

    public String getIdList() {
        return idList;
    }

    public List<String> getIdMembers() {
        return idMembers == null ? new ArrayList<>() : idMembers;
    }

    public void setIdMembers(List<String> idMembers) {
        this.idMembers = idMembers;
    }

    public List<Label> getLabels() {
        return labels == null ? new ArrayList<>() : labels;
    }

    public void setLabels(List<Label> labels) {
        this.labels = labels;
    }

    public double getPos() {
        return pos;
    }

    public void setPos(double pos) {
        this.pos = pos;
    }

    public String getShortUrl() {
        return shortUrl;
    }

    public void setShortUrl(String shortUrl) {
        this.shortUrl = shortUrl;
    }

    public String getUrl() {
        return url;
    }

    public boolean isClosed() {
        return closed;
    }

    public void setClosed(boolean closed) {
        this.closed = closed;
    }

    public static class Label {
        private String id;
        private String name;
        private String color;

        public Label() {
        }

        public Label(String name, String color) {
            this.name = name;
            this.color = color;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getColor() {
            return color;
        }
    }

    public static class Attachment {
        private String id;
        private String name;
        private String url;
        private Long bytes;
        private String mimeType;
        private String idMember;

        public Attachment() {
        }

        public Attachment(String id, String name, String url) {
            this.id = id;
            this.name = name;
            this.url = url;
        }

        public String getId() {
            return id;
        }

        public String getName() {
            return name;
        }

        public String getUrl() {
            return url;
        }

        public Long getBytes() {
            return bytes;
        }

        public String getMimeType() {
            return mimeType;
        }

        public String getIdMember() {
            return idMember;
        }
    }
}
