package com.stagewise.engine.api.store;

/**
 * Monotonic counter fields of a distribution counter record.
 */
public enum CounterField {
    STARTED("started_count"),
    COMPLETED("completed_count");

    private final String column;

    CounterField(String column) {
        this.column = column;
    }

    /**
     * Storage name of the field.
     */
    public String column() {
        return column;
    }
}
