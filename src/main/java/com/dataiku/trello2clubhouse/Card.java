package com.dataiku.trello2clubhouse;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.google.gson.annotations.SerializedName;

/**
 * A Trello card reduced to what the Clubhouse import needs.
 *
 * <p>{@link #sourceUrl} is the only field to correlate cards across runs, names may collide.
 * {@link #position} is kept as Trello gives it.
 */
public class Card {
    public String name;
    @SerializedName("desc")
    public String description;
    public List<String> labels = new ArrayList<>();
    @SerializedName("due_date")
    public Instant dueDate;
    @SerializedName("id_creator")
    public String creatorId;
    @SerializedName("id_owners")
    public Set<String> ownerIds = new LinkedHashSet<>();
    @SerializedName("created_at")
    public Instant createdAt;
    public List<Comment> comments = new ArrayList<>();
    @SerializedName("checklists")
    public List<Task> tasks = new ArrayList<>();
    public double position;
    @SerializedName("url")
    public String sourceUrl;
    // sanitized file name -> shared link
    public Map<String, String> attachments = new LinkedHashMap<>();

    @Override
    public String toString() {
        return name + " (" + sourceUrl + ")";
    }
}
