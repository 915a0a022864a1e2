package com.dataiku.trello2clubhouse;

import java.util.UUID;

import com.dataiku.trello2clubhouse.clubhouse.Project;
import com.dataiku.trello2clubhouse.clubhouse.WorkflowState;
import com.google.common.base.Preconditions;

/**
 * Where and as whom stories get created.
 */
public class ImportSettings {
    private final Project project;
    private final WorkflowState workflowState;
    private final String storyType;
    private final UUID importMemberId;
    private final boolean addCommentWithTrelloLink;

    public ImportSettings(Project project, WorkflowState workflowState, String storyType, UUID importMemberId, boolean addCommentWithTrelloLink) {
        Preconditions.checkArgument(MigrationParams.STORY_TYPES.contains(storyType), "Unknown story type: %s", storyType);
        this.project = Preconditions.checkNotNull(project);
        this.workflowState = Preconditions.checkNotNull(workflowState);
        this.storyType = storyType;
        this.importMemberId = Preconditions.checkNotNull(importMemberId);
        this.addCommentWithTrelloLink = addCommentWithTrelloLink;
    }

    public Project getProject() {
        return project;
    }

    public WorkflowState getWorkflowState() {
        return workflowState;
    }

    public String getStoryType() {
        return storyType;
    }

    public UUID getImportMemberId() {
        return importMemberId;
    }

    public boolean isAddCommentWithTrelloLink() {
        return addCommentWithTrelloLink;
    }
}
