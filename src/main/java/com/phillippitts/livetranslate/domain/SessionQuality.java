package com.phillippitts.livetranslate.domain;

/**
 * Outcome classification recorded when a session ends.
 */
public enum SessionQuality {
    UNKNOWN("unknown"),
    /** Presenter never had a listener within the empty-presenter timeout. */
    NO_LISTENERS("no_listeners"),
    /** Session went quiet: abandoned after listeners left, or generally stale. */
    NO_ACTIVITY("no_activity");

    private final String wireName;

    SessionQuality(String wireName) {
        this.wireName = wireName;
    }

    public String wireName() {
        return wireName;
    }
}
