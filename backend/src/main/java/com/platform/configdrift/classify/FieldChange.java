package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.TextNode;

/**
 * A changed field inside an item. A null field means the change covers the whole item.
 */
public record FieldChange(String field, JsonNode referenceValue, JsonNode currentValue) {

    /**
     * Marks "no value on this side".
     */
    public static final JsonNode NOT_AVAILABLE = TextNode.valueOf("N/A");

    /**
     * Field label for a scalar or type change of a top-level item.
     */
    public static final String WHOLE_ITEM_FIELD = "full_item_at_index";

    public static FieldChange wholeItem(JsonNode referenceValue, JsonNode currentValue) {
        return new FieldChange(null, orNotAvailable(referenceValue), orNotAvailable(currentValue));
    }

    static JsonNode orNotAvailable(JsonNode value) {
        return value == null ? NOT_AVAILABLE : value;
    }
}
