package com.dataiku.trello2clubhouse.clubhouse;

import java.time.Instant;
import java.util.UUID;

public class CreateCommentParams {
    public UUID author_id;
    public Instant created_at;
    public String text;
}
