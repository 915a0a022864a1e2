package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

import com.dataiku.trello2clubhouse.clubhouse.Clubhouse;
import com.dataiku.trello2clubhouse.clubhouse.Member;
import com.dataiku.trello2clubhouse.clubhouse.Project;
import com.dataiku.trello2clubhouse.clubhouse.Workflow;
import com.dataiku.trello2clubhouse.clubhouse.WorkflowState;

public class MigrationHelpers {

    private MigrationHelpers() {
    }

    public static Project getProject(Clubhouse clubhouse, String projectName) throws IOException {
        return clubhouse.listProjects().stream()
                .filter(p -> projectName.equals(p.name))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException("Unknown project on Clubhouse: " + projectName));
    }

    public static WorkflowState getStoryState(Clubhouse clubhouse, Project project, String stateName) throws IOException {
        for (WorkflowState state : getWorkflowStates(clubhouse, project)) {
            if (state.name.equalsIgnoreCase(stateName)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Cannot find the state '" + stateName + "' for project " + project.name);
    }

    public static List<WorkflowState> getWorkflowStates(Clubhouse clubhouse, Project project) throws IOException {
        List<WorkflowState> states = new ArrayList<>();
        for (Workflow workflow : clubhouse.listWorkflows()) {
            if (project.team_id == null || Objects.equals(project.team_id, workflow.team_id)) {
                states.addAll(workflow.states);
            }
        }
        if (states.isEmpty()) {
            throw new IllegalStateException("No workflow for the team of project " + project.name);
        }
        return states;
    }

    public static Member getMember(List<Member> members, String mentionName) {
        return members.stream()
                .filter(m -> m.profile != null && mentionName.equalsIgnoreCase(m.profile.mention_name))
                .findAny()
                .orElseThrow(() -> new IllegalArgumentException("Unknown member on Clubhouse: " + mentionName));
    }
}
