package com.platform.configdrift.diff;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.error.InvalidSnapshotException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Order-insensitive structural diff of two snapshots.
 *
 * Sequences of maps are matched by a grouping key when one is given and every element carries it;
 * other sequences are compared as multisets. Inputs are never modified.
 */
@Slf4j
@Component
public class StructuralDiffer {

    public List<DiffEvent> diff(JsonNode baseline, JsonNode current) {
        return diff(baseline, current, null);
    }

    public List<DiffEvent> diff(JsonNode baseline, JsonNode current, String groupingKey) {
        requireContainer(baseline, "Baseline");
        requireContainer(current, "Current");

        String key = groupingKey == null || groupingKey.isBlank() ? null : groupingKey;
        List<DiffEvent> events = new ArrayList<>();
        compareNodes(baseline, current, List.of(), key, events);

        log.debug("Structural diff produced {} events (grouping key: {})", events.size(), key);
        return events;
    }

    private void requireContainer(JsonNode node, String side) {
        if (!JsonValues.isContainer(node)) {
            throw new InvalidSnapshotException(side, node == null ? "null" : node.getNodeType().name());
        }
    }

    private void compareNodes(JsonNode baseline, JsonNode current, List<PathSegment> path,
                              String groupingKey, List<DiffEvent> events) {
        if (baseline.isObject() && current.isObject()) {
            compareObjects(baseline, current, path, groupingKey, events);
        } else if (baseline.isArray() && current.isArray()) {
            compareArrays(baseline, current, path, groupingKey, events);
        } else if (baseline.isNumber() && current.isNumber()) {
            if (!JsonValues.equivalent(baseline, current)) {
                events.add(DiffEvent.valueChanged(path, baseline, current));
            }
        } else if (baseline.getNodeType() != current.getNodeType()) {
            events.add(DiffEvent.typeChanged(path, baseline, current));
        } else if (!baseline.equals(current)) {
            events.add(DiffEvent.valueChanged(path, baseline, current));
        }
    }

    private void compareObjects(JsonNode baseline, JsonNode current, List<PathSegment> path,
                                String groupingKey, List<DiffEvent> events) {
        Iterator<Map.Entry<String, JsonNode>> baselineFields = baseline.fields();
        while (baselineFields.hasNext()) {
            Map.Entry<String, JsonNode> field = baselineFields.next();
            List<PathSegment> childPath = append(path, PathSegment.key(field.getKey()));
            JsonNode counterpart = current.get(field.getKey());
            if (counterpart == null) {
                events.add(DiffEvent.itemRemoved(childPath, field.getValue()));
            } else {
                compareNodes(field.getValue(), counterpart, childPath, groupingKey, events);
            }
        }

        Iterator<Map.Entry<String, JsonNode>> currentFields = current.fields();
        while (currentFields.hasNext()) {
            Map.Entry<String, JsonNode> field = currentFields.next();
            if (!baseline.has(field.getKey())) {
                events.add(DiffEvent.itemAdded(append(path, PathSegment.key(field.getKey())), field.getValue()));
            }
        }
    }

    private void compareArrays(JsonNode baseline, JsonNode current, List<PathSegment> path,
                               String groupingKey, List<DiffEvent> events) {
        if (groupingKey != null) {
            Map<PathSegment, JsonNode> baselineGroups = groupElements(baseline, groupingKey, path);
            Map<PathSegment, JsonNode> currentGroups = groupElements(current, groupingKey, path);
            if (baselineGroups != null && currentGroups != null) {
                compareGroups(baselineGroups, currentGroups, path, groupingKey, events);
                return;
            }
            if (containsObject(baseline) || containsObject(current)) {
                log.warn("Sequence at {} cannot be grouped by '{}', comparing as unordered sequence",
                    PathCodec.render(path), groupingKey);
            }
        }
        compareUnordered(baseline, current, path, events);
    }

    /**
     * Indexes elements by grouping-key value, or returns null when some element is not a map carrying the key.
     */
    private Map<PathSegment, JsonNode> groupElements(JsonNode array, String groupingKey, List<PathSegment> path) {
        Map<PathSegment, JsonNode> groups = new LinkedHashMap<>();
        for (JsonNode element : array) {
            JsonNode keyValue = element.isObject() ? element.get(groupingKey) : null;
            if (keyValue == null || keyValue.isNull() || keyValue.isContainerNode()) {
                return null;
            }
            PathSegment segment = PathSegment.identity(keyValue);
            if (groups.put(segment, element) != null) {
                log.warn("Duplicate value '{}' for grouping key '{}' at {}, keeping last element",
                    segment, groupingKey, PathCodec.render(path));
            }
        }
        return groups;
    }

    private void compareGroups(Map<PathSegment, JsonNode> baselineGroups, Map<PathSegment, JsonNode> currentGroups,
                               List<PathSegment> path, String groupingKey, List<DiffEvent> events) {
        baselineGroups.forEach((segment, element) -> {
            List<PathSegment> childPath = append(path, segment);
            JsonNode counterpart = currentGroups.get(segment);
            if (counterpart == null) {
                events.add(DiffEvent.iterableItemRemoved(childPath, element));
            } else {
                compareNodes(element, counterpart, childPath, groupingKey, events);
            }
        });
        currentGroups.forEach((segment, element) -> {
            if (!baselineGroups.containsKey(segment)) {
                events.add(DiffEvent.iterableItemAdded(append(path, segment), element));
            }
        });
    }

    private void compareUnordered(JsonNode baseline, JsonNode current, List<PathSegment> path,
                                  List<DiffEvent> events) {
        boolean[] matched = new boolean[current.size()];
        List<Integer> unmatchedBaseline = new ArrayList<>();

        for (int i = 0; i < baseline.size(); i++) {
            JsonNode element = baseline.get(i);
            boolean found = false;
            for (int j = 0; j < current.size(); j++) {
                if (!matched[j] && JsonValues.equivalent(element, current.get(j))) {
                    matched[j] = true;
                    found = true;
                    break;
                }
            }
            if (!found) {
                unmatchedBaseline.add(i);
            }
        }

        for (int i : unmatchedBaseline) {
            events.add(DiffEvent.iterableItemRemoved(append(path, PathSegment.index(i)), baseline.get(i)));
        }
        for (int j = 0; j < current.size(); j++) {
            if (!matched[j]) {
                events.add(DiffEvent.iterableItemAdded(append(path, PathSegment.index(j)), current.get(j)));
            }
        }
    }

    private static boolean containsObject(JsonNode array) {
        for (JsonNode element : array) {
            if (element.isObject()) {
                return true;
            }
        }
        return false;
    }

    private static List<PathSegment> append(List<PathSegment> path, PathSegment segment) {
        List<PathSegment> childPath = new ArrayList<>(path.size() + 1);
        childPath.addAll(path);
        childPath.add(segment);
        return childPath;
    }
}
