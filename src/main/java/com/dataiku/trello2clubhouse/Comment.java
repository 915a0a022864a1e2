package com.dataiku.trello2clubhouse;

import java.time.Instant;

import com.google.gson.annotations.SerializedName;

public class Comment {
    public String text;
    @SerializedName("id_creator")
    public String authorSourceId;
    @SerializedName("creator_name")
    public String authorDisplayName;
    @SerializedName("created_at")
    public Instant createdAt;

    public Comment() {
    }

    public Comment(String text, String authorSourceId, String authorDisplayName, Instant createdAt) {
        this.text = text;
        this.authorSourceId = authorSourceId;
        this.authorDisplayName = authorDisplayName;
        this.createdAt = createdAt;
    }
}
