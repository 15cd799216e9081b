package com.platform.configdrift.classify;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Status of a changed item. When one item collects several statuses, removed wins over added, added over changed.
 */
public enum ChangeStatus {
    CHANGED("changed", 1),
    ADDED("added", 2),
    REMOVED("removed", 3);

    private final String value;
    private final int precedence;

    ChangeStatus(String value, int precedence) {
        this.value = value;
        this.precedence = precedence;
    }

    @JsonValue
    public String getValue() {
        return value;
    }

    /**
     * Combines an existing status (possibly null) with a new one.
     */
    public static ChangeStatus escalate(ChangeStatus existing, ChangeStatus incoming) {
        if (existing == null) {
            return incoming;
        }
        return incoming.precedence > existing.precedence ? incoming : existing;
    }

    public boolean isWholeItem() {
        return this == ADDED || this == REMOVED;
    }
}
