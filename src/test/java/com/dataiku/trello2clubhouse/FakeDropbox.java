package com.dataiku.trello2clubhouse;

import java.io.IOException;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import com.dataiku.trello2clubhouse.dropbox.Dropbox;
import com.dataiku.trello2clubhouse.dropbox.FileMetadata;
import com.dataiku.trello2clubhouse.dropbox.SharedLink;
import com.dataiku.trello2clubhouse.dropbox.UploadInput;

class FakeDropbox implements Dropbox {
    final Map<String, byte[]> files = new LinkedHashMap<>();
    final Map<String, List<SharedLink>> links = new LinkedHashMap<>();
    final List<UploadInput> uploads = new ArrayList<>();
    final Set<String> failingUploads = new HashSet<>();
    final Set<String> failingShares = new HashSet<>();
    boolean failListing;
    int createdLinks;

    @Override
    public FileMetadata upload(UploadInput input) throws IOException {
        if (failingUploads.contains(input.path)) {
            throw new IOException("insufficient_space");
        }
        if (!UploadInput.MODE_OVERWRITE.equals(input.mode) && files.containsKey(input.path)) {
            throw new IOException("conflict on " + input.path);
        }
        uploads.add(input);
        files.put(input.path, input.content);
        return new FileMetadata(input.path);
    }

    @Override
    public List<SharedLink> listSharedLinks(String path) throws IOException {
        if (failListing) {
            throw new IOException("too_many_requests");
        }
        return new ArrayList<>(links.getOrDefault(path.toLowerCase(), new ArrayList<>()));
    }

    @Override
    public SharedLink createSharedLink(String path) throws IOException {
        if (failingShares.contains(path)) {
            throw new IOException("shared_link_access_denied");
        }
        if (links.containsKey(path.toLowerCase())) {
            throw new IOException("shared_link_already_exists");
        }
        createdLinks++;
        SharedLink link = new SharedLink("https://www.dropbox.com/s/" + createdLinks + path.substring(path.lastIndexOf('/')) + "?dl=0", path.toLowerCase(), null);
        List<SharedLink> pathLinks = new ArrayList<>();
        pathLinks.add(link);
        links.put(path.toLowerCase(), pathLinks);
        return link;
    }
}
