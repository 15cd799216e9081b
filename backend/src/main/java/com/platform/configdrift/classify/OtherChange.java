package com.platform.configdrift.classify;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * A difference that could not be attributed to a top-level item.
 */
public record OtherChange(Object itemId, String field, JsonNode referenceValue, JsonNode currentValue) {

    public static final String ROOT_ITEM = "root";
    public static final String ROOT_FIELD = "type_or_full_value_change";

    @JsonProperty("status")
    public String status() {
        return "other";
    }
}
