package com.platform.configdrift.diff;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Kinds of structural difference reported by {@link StructuralDiffer}.
 */
public enum DiffKind {
    VALUE_CHANGED("values_changed"),
    ITEM_ADDED("dictionary_item_added"),
    ITEM_REMOVED("dictionary_item_removed"),
    ITERABLE_ITEM_ADDED("iterable_item_added"),
    ITERABLE_ITEM_REMOVED("iterable_item_removed"),
    TYPE_CHANGED("type_changes"),
    SET_ADDED("set_item_added"),
    SET_REMOVED("set_item_removed");

    private final String wireName;

    DiffKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String getWireName() {
        return wireName;
    }

    public boolean isAddition() {
        return this == ITEM_ADDED || this == ITERABLE_ITEM_ADDED;
    }

    public boolean isRemoval() {
        return this == ITEM_REMOVED || this == ITERABLE_ITEM_REMOVED;
    }

    public boolean isSetChange() {
        return this == SET_ADDED || this == SET_REMOVED;
    }
}
