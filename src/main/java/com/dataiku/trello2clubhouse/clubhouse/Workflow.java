package com.dataiku.trello2clubhouse.clubhouse;

import java.util.ArrayList;
import java.util.List;

public class Workflow {
    public long id;
    public String name;
    public Long team_id;
    public List<WorkflowState> states = new ArrayList<>();

    public Workflow() {
    }

    public Workflow(long id, String name, List<WorkflowState> states) {
        this.id = id;
        this.name = name;
        this.states = states;
    }
}
