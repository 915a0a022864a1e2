package com.dataiku.trello2clubhouse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared links of the attachments that made it to Dropbox, and what happened to the others.
 */
public class RelocationResult {
    private final Map<String, String> sharedLinks = new LinkedHashMap<>();
    private final List<AttachmentFailure> failures = new ArrayList<>();

    void addSharedLink(String fileName, String url) {
        sharedLinks.put(fileName, url);
    }

    void addFailure(AttachmentFailure failure) {
        failures.add(failure);
    }

    public Map<String, String> getSharedLinks() {
        return Collections.unmodifiableMap(sharedLinks);
    }

    public List<AttachmentFailure> getFailures() {
        return Collections.unmodifiableList(failures);
    }

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
