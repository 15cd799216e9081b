package com.platform.configdrift.drift;

import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.configdrift.error.UnsupportedEngineException;

import java.util.Arrays;
import java.util.List;

/**
 * Names under which comparison engines are selected.
 */
public enum ComparisonMethod {
    STRUCTURAL("deepdiff", "structural"),
    FLAT("flat");

    private final String name;
    private final List<String> aliases;

    ComparisonMethod(String name, String... aliases) {
        this.name = name;
        this.aliases = List.of(aliases);
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public static ComparisonMethod fromName(String value) {
        if (value == null) {
            throw new UnsupportedEngineException("null");
        }
        String normalized = value.trim().toLowerCase();
        return Arrays.stream(values())
            .filter(method -> method.name.equals(normalized) || method.aliases.contains(normalized))
            .findFirst()
            .orElseThrow(() -> new UnsupportedEngineException(value));
    }
}
