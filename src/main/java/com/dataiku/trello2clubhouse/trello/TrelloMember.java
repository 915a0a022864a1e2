package com.dataiku.trello2clubhouse.trello;

public class TrelloMember {

    private String id;
    private String username;
    private String fullName;

    public TrelloMember() {
    }

    public TrelloMember(String id, String username, String fullName) {
        this.id = id;
        this.username = username;
        this.fullName = fullName;
    }

    public String getId() {
        return id;
    }

    public String getUsername() {
        return username;
    }

    public String getFullName() {
        return fullName;
    }
}
