package com.platform.configdrift.classify;

import java.util.List;

/**
 * All changes of one top-level item.
 */
public record EntityChange(Object itemId, ChangeStatus status, List<FieldChange> changes) {

    public EntityChange {
        changes = List.copyOf(changes);
    }
}
