package com.dataiku.trello2clubhouse.dropbox;

import com.google.gson.annotations.SerializedName;

public class FileMetadata {

    public String id;
    public String name;
    @SerializedName("path_lower")
    public String pathLower;
    @SerializedName("path_display")
    public String pathDisplay;

    public FileMetadata() {
    }

    public FileMetadata(String pathDisplay) {
        this.pathDisplay = pathDisplay;
        this.pathLower = pathDisplay == null ? null : pathDisplay.toLowerCase();
    }
}
