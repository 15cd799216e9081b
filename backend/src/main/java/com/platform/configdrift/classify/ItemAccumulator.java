package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Collects the changes of one item while events are classified.
 */
class ItemAccumulator {

    private final Object itemId;
    private final List<FieldChange> changes = new ArrayList<>();
    private ChangeStatus status;
    private JsonNode fullReference;
    private JsonNode fullCurrent;

    ItemAccumulator(Object itemId) {
        this.itemId = itemId;
    }

    void markAdded(JsonNode value) {
        fullCurrent = value;
        status = ChangeStatus.escalate(status, ChangeStatus.ADDED);
    }

    void markRemoved(JsonNode value) {
        fullReference = value;
        status = ChangeStatus.escalate(status, ChangeStatus.REMOVED);
    }

    void addFieldChange(FieldChange change) {
        changes.add(change);
        status = ChangeStatus.escalate(status, ChangeStatus.CHANGED);
    }

    /**
     * Returns null when nothing was recorded for the item.
     */
    EntityChange toEntityChange() {
        if (status == null) {
            return null;
        }
        if (status.isWholeItem()) {
            // per-field changes of an added or removed item are superseded by the whole value
            return new EntityChange(itemId, status, List.of(FieldChange.wholeItem(fullReference, fullCurrent)));
        }
        if (changes.isEmpty()) {
            return null;
        }
        return new EntityChange(itemId, status, changes);
    }
}
