package com.dataiku.trello2clubhouse.clubhouse;

public class Story {
    public long id;
    public String name;
    public Long project_id;
    public String app_url;
    public String external_id;

    public Story() {
    }

    public Story(long id, String name, Long projectId) {
        this.id = id;
        this.name = name;
        this.project_id = projectId;
    }
}
