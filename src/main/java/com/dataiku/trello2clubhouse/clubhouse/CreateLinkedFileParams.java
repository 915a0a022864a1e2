package com.dataiku.trello2clubhouse.clubhouse;

import java.util.UUID;

public class CreateLinkedFileParams {
    public static final String TYPE_DROPBOX = "dropbox";

    public String name;
    public String type;
    public String url;
    public UUID uploader_id;
    public String description;
}
