package com.dataiku.trello2clubhouse.clubhouse;

public class LinkedFile {
    public long id;
    public String name;
    public String type;
    public String url;

    public LinkedFile() {
    }

    public LinkedFile(long id, String name, String url) {
        this.id = id;
        this.name = name;
        this.url = url;
    }
}
