package com.dataiku.trello2clubhouse.clubhouse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Body of {@code POST /api/v3/stories}. Unset fields are not serialized.
 */
public class CreateStoryParams {
    public String name;
    public String description;
    public Long project_id;
    public Long workflow_state_id;
    public String story_type;
    public UUID requested_by_id;
    public List<UUID> owner_ids = new ArrayList<>();
    public List<UUID> follower_ids = new ArrayList<>();
    public List<Long> file_ids = new ArrayList<>();
    public List<Long> linked_file_ids = new ArrayList<>();
    public Instant deadline;
    public Instant created_at;
    public List<CreateLabelParams> labels = new ArrayList<>();
    public List<CreateTaskParams> tasks = new ArrayList<>();
    public List<CreateCommentParams> comments = new ArrayList<>();
    public String external_id;
}
