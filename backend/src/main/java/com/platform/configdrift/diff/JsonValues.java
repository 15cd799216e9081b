package com.platform.configdrift.diff;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Map;

/**
 * Equality and id helpers over Jackson trees.
 */
public final class JsonValues {

    private JsonValues() {
    }

    /**
     * Deep equality where numbers compare by value (1 == 1.0) and sequences compare as multisets.
     */
    public static boolean equivalent(JsonNode left, JsonNode right) {
        if (left == right) {
            return true;
        }
        if (left == null || right == null) {
            return false;
        }
        if (left.isNumber() && right.isNumber()) {
            return left.decimalValue().compareTo(right.decimalValue()) == 0;
        }
        if (left.getNodeType() != right.getNodeType()) {
            return false;
        }
        if (left.isObject()) {
            return objectsEquivalent(left, right);
        }
        if (left.isArray()) {
            return arraysEquivalent(left, right);
        }
        return left.equals(right);
    }

    private static boolean objectsEquivalent(JsonNode left, JsonNode right) {
        if (left.size() != right.size()) {
            return false;
        }
        Iterator<Map.Entry<String, JsonNode>> fields = left.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            if (!equivalent(field.getValue(), right.get(field.getKey()))) {
                return false;
            }
        }
        return true;
    }

    private static boolean arraysEquivalent(JsonNode left, JsonNode right) {
        if (left.size() != right.size()) {
            return false;
        }
        List<JsonNode> unmatched = new ArrayList<>();
        right.forEach(unmatched::add);
        for (JsonNode element : left) {
            boolean found = false;
            for (Iterator<JsonNode> it = unmatched.iterator(); it.hasNext(); ) {
                if (equivalent(element, it.next())) {
                    it.remove();
                    found = true;
                    break;
                }
            }
            if (!found) {
                return false;
            }
        }
        return true;
    }

    /**
     * Converts a JSON scalar into an item id: Integer or Long for integral numbers, text otherwise.
     */
    public static Object toItemId(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return null;
        }
        if (value.isIntegralNumber()) {
            if (value.canConvertToInt()) {
                return value.intValue();
            }
            if (value.canConvertToLong()) {
                return value.longValue();
            }
            return value.asText();
        }
        if (value.isValueNode()) {
            return value.asText();
        }
        return value.toString();
    }

    /**
     * Whether the node is a map or a sequence.
     */
    public static boolean isContainer(JsonNode node) {
        return node != null && node.isContainerNode();
    }
}
