package com.dagnet.analytics.slice;

/**
 * Aggregation mode of a slice: calendar-date windows or entry-cohort windows.
 */
public enum SliceMode {
    WINDOW("window"),
    COHORT("cohort");

    private final String function;

    SliceMode(String function) {
        this.function = function;
    }

    public String function() {
        return function;
    }
}
