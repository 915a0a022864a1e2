package com.dataiku.trello2clubhouse.clubhouse;

public class Project {
    public long id;
    public String name;
    public Long team_id;
    public Boolean archived;

    public Project() {
    }

    public Project(long id, String name) {
        this.id = id;
        this.name = name;
    }
}
