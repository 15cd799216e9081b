package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.diff.DiffEvent;
import com.platform.configdrift.diff.PathCodec;
import com.platform.configdrift.diff.PathComponents;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Groups structural diff events by top-level item and assigns each item a status.
 */
@Slf4j
@Component
public class DiffClassifier {

    public Classification classify(List<DiffEvent> events) {
        Map<Object, ItemAccumulator> items = new LinkedHashMap<>();
        List<OtherChange> other = new ArrayList<>();

        for (DiffEvent event : events) {
            if (event.path().isEmpty()) {
                classifyRootReplacement(event, items, other);
                continue;
            }
            if (event.kind().isSetChange()) {
                other.add(new OtherChange(null, event.renderedPath(), event.oldValue(), event.newValue()));
                continue;
            }

            PathComponents components = PathCodec.decode(event.path());
            if (!components.hasItemId()) {
                other.add(new OtherChange(null, event.renderedPath(), event.oldValue(), event.newValue()));
                continue;
            }

            ItemAccumulator item = items.computeIfAbsent(components.itemId(), ItemAccumulator::new);
            if (components.rootItem()) {
                if (event.kind().isAddition()) {
                    item.markAdded(event.newValue());
                } else if (event.kind().isRemoval()) {
                    item.markRemoved(event.oldValue());
                } else {
                    item.addFieldChange(new FieldChange(FieldChange.WHOLE_ITEM_FIELD,
                        FieldChange.orNotAvailable(event.oldValue()), FieldChange.orNotAvailable(event.newValue())));
                }
            } else {
                item.addFieldChange(new FieldChange(components.fieldPath(),
                    FieldChange.orNotAvailable(event.oldValue()), FieldChange.orNotAvailable(event.newValue())));
            }
        }

        List<EntityChange> relevant = items.values().stream()
            .map(ItemAccumulator::toEntityChange)
            .filter(Objects::nonNull)
            .toList();

        log.debug("Classified {} events into {} item changes and {} other changes",
            events.size(), relevant.size(), other.size());
        return new Classification(relevant, other);
    }

    public ComparisonSummary summarize(Classification classification, List<DiffEvent> rawDiff) {
        return ComparisonSummary.of(classification.relevant(), classification.other(), rawDiff);
    }

    /**
     * The whole snapshot changed type: fan out the keys of whichever side is a map.
     * A side that is not a map is kept as one root-level other change.
     */
    private void classifyRootReplacement(DiffEvent event, Map<Object, ItemAccumulator> items, List<OtherChange> other) {
        JsonNode oldValue = event.oldValue();
        JsonNode newValue = event.newValue();
        boolean oldIsMap = oldValue != null && oldValue.isObject();
        boolean newIsMap = newValue != null && newValue.isObject();

        if (oldIsMap) {
            Iterator<Map.Entry<String, JsonNode>> fields = oldValue.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                items.computeIfAbsent(field.getKey(), ItemAccumulator::new).markRemoved(field.getValue());
            }
        }
        if (newIsMap) {
            Iterator<Map.Entry<String, JsonNode>> fields = newValue.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> field = fields.next();
                items.computeIfAbsent(field.getKey(), ItemAccumulator::new).markAdded(field.getValue());
            }
        }
        if (!oldIsMap || !newIsMap) {
            other.add(new OtherChange(OtherChange.ROOT_ITEM, OtherChange.ROOT_FIELD,
                FieldChange.orNotAvailable(oldValue), FieldChange.orNotAvailable(newValue)));
        }
    }
}
