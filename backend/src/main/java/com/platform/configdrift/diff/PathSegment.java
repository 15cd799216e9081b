package com.platform.configdrift.diff;

import com.fasterxml.jackson.annotation.JsonValue;
import com.fasterxml.jackson.databind.JsonNode;

import java.util.Objects;

/**
 * One step of a diff path: a map key (String) or a sequence position (Integer or Long).
 * Elements of grouped sequences are addressed by their grouping-key value.
 */
public record PathSegment(Object value) {

    public PathSegment {
        Objects.requireNonNull(value, "value");
        if (!(value instanceof String || value instanceof Integer || value instanceof Long)) {
            throw new IllegalArgumentException("Path segment must be a String, Integer or Long: " + value.getClass());
        }
    }

    public static PathSegment key(String key) {
        return new PathSegment(key);
    }

    public static PathSegment index(int index) {
        return new PathSegment(index);
    }

    /**
     * Segment for a grouped element: integral key values become index segments, anything else a key segment.
     */
    public static PathSegment identity(JsonNode keyValue) {
        return new PathSegment(JsonValues.toItemId(keyValue));
    }

    @JsonValue
    @Override
    public Object value() {
        return value;
    }

    public boolean isIndex() {
        return !(value instanceof String);
    }

    /**
     * Display form used in raw paths, e.g. {@code ['name']} or {@code [3]}.
     */
    public String render() {
        return isIndex() ? "[" + value + "]" : "['" + value + "']";
    }

    @Override
    public String toString() {
        return String.valueOf(value);
    }
}
