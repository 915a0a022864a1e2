package com.dataiku.trello2clubhouse.dropbox;

import com.google.gson.annotations.SerializedName;

/**
 * Arguments of {@code files/upload}. The content is sent as the request body, the rest as the API argument header.
 */
public class UploadInput {

    public static final String MODE_OVERWRITE = "overwrite";

    public String path;
    public String mode = MODE_OVERWRITE;
    public boolean autorename;
    public boolean mute;
    @SerializedName("client_modified")
    public String clientModified;
    public transient byte[] content;

    public UploadInput() {
    }

    public UploadInput(String path, byte[] content) {
        this.path = path;
        this.content = content;
    }
}
