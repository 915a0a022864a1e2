package com.dataiku.trello2clubhouse.clubhouse;

public class CreateTaskParams {
    public boolean complete;
    public String description;

    public CreateTaskParams() {
    }

    public CreateTaskParams(boolean complete, String description) {
        this.complete = complete;
        this.description = description;
    }
}
