package com.platform.configdrift.diff;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.List;

/**
 * A single structural difference. Old and new values are null when the side has no value,
 * e.g. the old value of an added item.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record DiffEvent(DiffKind kind, List<PathSegment> path, JsonNode oldValue, JsonNode newValue) {

    public DiffEvent {
        path = List.copyOf(path);
    }

    public static DiffEvent valueChanged(List<PathSegment> path, JsonNode oldValue, JsonNode newValue) {
        return new DiffEvent(DiffKind.VALUE_CHANGED, path, oldValue, newValue);
    }

    public static DiffEvent typeChanged(List<PathSegment> path, JsonNode oldValue, JsonNode newValue) {
        return new DiffEvent(DiffKind.TYPE_CHANGED, path, oldValue, newValue);
    }

    public static DiffEvent itemAdded(List<PathSegment> path, JsonNode newValue) {
        return new DiffEvent(DiffKind.ITEM_ADDED, path, null, newValue);
    }

    public static DiffEvent itemRemoved(List<PathSegment> path, JsonNode oldValue) {
        return new DiffEvent(DiffKind.ITEM_REMOVED, path, oldValue, null);
    }

    public static DiffEvent iterableItemAdded(List<PathSegment> path, JsonNode newValue) {
        return new DiffEvent(DiffKind.ITERABLE_ITEM_ADDED, path, null, newValue);
    }

    public static DiffEvent iterableItemRemoved(List<PathSegment> path, JsonNode oldValue) {
        return new DiffEvent(DiffKind.ITERABLE_ITEM_REMOVED, path, oldValue, null);
    }

    public String renderedPath() {
        return PathCodec.render(path);
    }
}
