package com.dataiku.trello2clubhouse;

/**
 * Progress of one card through the import: {@code PENDING -> DUPLICATE_CHECK -> DELETED|NO_MATCH -> SUBMITTED ->
 * SUCCESS|FAILED}.
 */
public enum ImportState {
    PENDING,
    DUPLICATE_CHECK,
    DELETED,
    NO_MATCH,
    SUBMITTED,
    SUCCESS,
    FAILED;

    public boolean isTerminal() {
        return this == SUCCESS || this == FAILED;
    }
}
