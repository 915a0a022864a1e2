package com.dataiku.trello2clubhouse.clubhouse;

public class WorkflowState {
    public long id;
    public String name;
    public String type;

    public WorkflowState() {
    }

    public WorkflowState(long id, String name, String type) {
        this.id = id;
        this.name = name;
        this.type = type;
    }
}
