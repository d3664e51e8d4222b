package dev.jobaggregator.model;

/**
 * Terminal status of one source within a search run.
 */
public enum OutcomeStatus {
    OK,
    PARTIAL,
    BLOCKED,
    ERROR;

    public boolean isSuccessful() {
        return this == OK || this == PARTIAL;
    }
}
