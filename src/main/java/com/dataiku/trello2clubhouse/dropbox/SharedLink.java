package com.dataiku.trello2clubhouse.dropbox;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

import com.google.gson.annotations.SerializedName;

/**
 * Public link on an uploaded file. {@link #expires} is {@code null} for links that never expire.
 */
public class SharedLink {

    public String url;
    @SerializedName("path_lower")
    public String canonicalPath;
    public Instant expires;

    public SharedLink() {
    }

    public SharedLink(String url, String canonicalPath, Instant expires) {
        this.url = url;
        this.canonicalPath = canonicalPath;
        this.expires = expires;
    }

    static class SharedLinks {
        List<SharedLink> links = new ArrayList<>();
    }
}
