package com.dataiku.trello2clubhouse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of an import run, one result per card in processing order.
 */
public class ImportReport {
    private final List<ImportResult> results = new ArrayList<>();

    void add(ImportResult result) {
        results.add(result);
    }

    public List<ImportResult> getResults() {
        return Collections.unmodifiableList(results);
    }

    public List<ImportResult> getFailures() {
        return results.stream().filter(r -> !r.isSuccess()).collect(Collectors.toList());
    }

    public int getSuccessCount() {
        return results.size() - getFailures().size();
    }

    public boolean hasFailures() {
        return !getFailures().isEmpty();
    }

    public String summary() {
        return "Imported " + getSuccessCount() + " of " + results.size() + " cards, " + getFailures().size() + " failed";
    }
}
