package com.dataiku.trello2clubhouse;

import java.time.ZoneId;

import com.google.common.base.Preconditions;

public class RelocationSettings {
    private final String folder;
    private final ZoneId clientModifiedZone;

    public RelocationSettings(String folder, ZoneId clientModifiedZone) {
        Preconditions.checkArgument(folder != null && folder.startsWith("/"), "Dropbox folder must be absolute: %s", folder);
        this.folder = folder.endsWith("/") ? folder.substring(0, folder.length() - 1) : folder;
        this.clientModifiedZone = Preconditions.checkNotNull(clientModifiedZone);
    }

    public String getFolder() {
        return folder;
    }

    public ZoneId getClientModifiedZone() {
        return clientModifiedZone;
    }
}
