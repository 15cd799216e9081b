package com.platform.configdrift.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.NullNode;
import com.platform.configdrift.classify.ChangeStatus;
import com.platform.configdrift.error.InvalidSnapshotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Compares snapshots as flat maps of dotted keys, e.g. {@code ssids.0.name}.
 */
@Slf4j
@Component
public class FlatDiffer {

    public static final String SEPARATOR = ".";

    /**
     * Flattens a tree into dotted keys. Map keys and sequence indexes become path parts;
     * empty containers contribute nothing and a scalar root yields the single key "".
     */
    public Map<String, JsonNode> flatten(JsonNode snapshot) {
        Map<String, JsonNode> flattened = new LinkedHashMap<>();
        flattenInto(snapshot == null ? NullNode.getInstance() : snapshot, "", flattened);
        return flattened;
    }

    private void flattenInto(JsonNode node, String prefix, Map<String, JsonNode> flattened) {
        if (node.isObject()) {
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                flattenInto(field.getValue(), join(prefix, field.getKey()), flattened);
            }
        } else if (node.isArray()) {
            for (int i = 0; i < node.size(); i++) {
                flattenInto(node.get(i), join(prefix, String.valueOf(i)), flattened);
            }
        } else {
            flattened.put(prefix, node);
        }
    }

    private static String join(String prefix, String part) {
        return prefix.isEmpty() ? part : prefix + SEPARATOR + part;
    }

    /**
     * Compares the flattened forms over the sorted union of keys; equal values are omitted.
     */
    public FlatComparison compare(JsonNode baseline, JsonNode current) {
        requireContainer(baseline, "Baseline");
        requireContainer(current, "Current");

        Map<String, JsonNode> flatBaseline = flatten(baseline);
        Map<String, JsonNode> flatCurrent = flatten(current);

        TreeSet<String> keys = new TreeSet<>(flatBaseline.keySet());
        keys.addAll(flatCurrent.keySet());

        List<FlatChange> changes = new ArrayList<>();
        for (String key : keys) {
            JsonNode reference = flatBaseline.get(key);
            JsonNode actual = flatCurrent.get(key);
            if (reference == null) {
                changes.add(new FlatChange(key, ChangeStatus.ADDED, null, actual));
            } else if (actual == null) {
                changes.add(new FlatChange(key, ChangeStatus.REMOVED, reference, null));
            } else if (!JsonValues.equivalent(reference, actual)) {
                changes.add(new FlatChange(key, ChangeStatus.CHANGED, reference, actual));
            }
        }

        log.debug("Flat comparison over {} keys found {} changes", keys.size(), changes.size());
        return new FlatComparison(!changes.isEmpty(), changes);
    }

    private void requireContainer(JsonNode node, String side) {
        if (!JsonValues.isContainer(node)) {
            throw new InvalidSnapshotException(side, node == null ? "null" : node.getNodeType().name());
        }
    }
}
