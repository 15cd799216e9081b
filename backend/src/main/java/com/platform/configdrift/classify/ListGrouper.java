package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;

/**
 * Turns a sequence of maps into a map keyed by each element's grouping-key value.
 */
@Slf4j
public final class ListGrouper {

    private ListGrouper() {
    }

    public static boolean isListOfMaps(JsonNode node) {
        if (node == null || !node.isArray()) {
            return false;
        }
        for (JsonNode element : node) {
            if (!element.isObject()) {
                return false;
            }
        }
        return true;
    }

    /**
     * Elements without the key are skipped; on duplicate key values the later element wins.
     */
    public static ObjectNode groupByKey(JsonNode list, String key, String label) {
        ObjectNode grouped = JsonNodeFactory.instance.objectNode();
        int index = 0;
        for (JsonNode element : list) {
            JsonNode keyValue = element.get(key);
            if (keyValue == null || keyValue.isNull()) {
                log.warn("Item at index {} in {} list has no '{}', skipping", index, label, key);
            } else {
                String id = keyValue.isValueNode() ? keyValue.asText() : keyValue.toString();
                if (grouped.has(id)) {
                    log.warn("Duplicate '{}' value '{}' in {} list, later item overwrites", key, id, label);
                }
                grouped.set(id, element);
            }
            index++;
        }
        return grouped;
    }
}
