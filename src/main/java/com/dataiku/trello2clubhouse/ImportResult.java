package com.dataiku.trello2clubhouse;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

public class ImportResult {
    private final Card card;
    private ImportState state = ImportState.PENDING;
    private Long storyId;
    private Exception error;
    private final List<Long> deletedStoryIds = new ArrayList<>();

    ImportResult(Card card) {
        this.card = card;
    }

    void moveTo(ImportState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Card " + card + " already " + state);
        }
        state = next;
    }

    void succeeded(long id) {
        moveTo(ImportState.SUCCESS);
        storyId = id;
    }

    void failed(Exception cause) {
        moveTo(ImportState.FAILED);
        error = cause;
    }

    void deleted(long id) {
        deletedStoryIds.add(id);
    }

    public Card getCard() {
        return card;
    }

    public ImportState getState() {
        return state;
    }

    public Long getStoryId() {
        return storyId;
    }

    public Exception getError() {
        return error;
    }

    public List<Long> getDeletedStoryIds() {
        return Collections.unmodifiableList(deletedStoryIds);
    }

    public boolean isSuccess() {
        return state == ImportState.SUCCESS;
    }

    String statusLine() {
        String link = card.sourceUrl == null ? card.name : card.sourceUrl;
        if (isSuccess()) {
            return String.format(StoryImporter.OUTPUT_FORMAT, link, "Success", "Story ID: " + storyId);
        }
        String details = error == null ? state.name() : Objects.toString(error.getMessage(), error.toString());
        return String.format(StoryImporter.OUTPUT_FORMAT, link, "Failed", details);
    }
}
