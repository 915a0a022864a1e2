package com.dataiku.trello2clubhouse;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Content of {@code trello-migration.json}.
 */
public class MigrationParams {
    public static final List<String> STORY_TYPES = Arrays.asList("feature", "bug", "chore");

    public String trelloBoard;

    // Names of the lists to migrate, all open lists when empty
    public List<String> trelloLists = new ArrayList<>();

    public String clubhouseProject;
    public String clubhouseWorkflowState = "Unscheduled";
    public String clubhouseStoryType = "feature";

    // Mention name of the Clubhouse member running the import
    public String importMember;

    public boolean processAttachments = true;
    public boolean addCommentWithTrelloLink = true;
    public String dropboxFolder = AttachmentRelocator.DEFAULT_FOLDER;
    public String clientModifiedZone = "UTC";

    public String exportFile = CardStore.DEFAULT_EXPORT_FILE;
    public int threads = 1;

    // key=trello username, value=clubhouse mention name
    public Map<String, String> usersMapping = new HashMap<>();

    public void validate() {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(clubhouseProject), "Missing 'clubhouseProject'");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(clubhouseWorkflowState), "Missing 'clubhouseWorkflowState'");
        Preconditions.checkArgument(!Strings.isNullOrEmpty(importMember), "Missing 'importMember'");
        Preconditions.checkArgument(STORY_TYPES.contains(clubhouseStoryType), "Unknown story type '%s', expected one of %s", clubhouseStoryType, STORY_TYPES);
        Preconditions.checkArgument(threads > 0, "'threads' must be positive but was %s", threads);
        ZoneId.of(clientModifiedZone);
    }

    public void validateExport() {
        Preconditions.checkArgument(!Strings.isNullOrEmpty(trelloBoard), "Missing 'trelloBoard'");
        Preconditions.checkArgument(threads > 0, "'threads' must be positive but was %s", threads);
        ZoneId.of(clientModifiedZone);
    }

    public RelocationSettings relocationSettings() {
        return new RelocationSettings(dropboxFolder, ZoneId.of(clientModifiedZone));
    }
}
