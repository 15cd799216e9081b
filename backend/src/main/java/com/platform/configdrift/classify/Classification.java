package com.platform.configdrift.classify;

import java.util.List;

/**
 * Changes attributed to items, and the rest.
 */
public record Classification(List<EntityChange> relevant, List<OtherChange> other) {

    public Classification {
        relevant = List.copyOf(relevant);
        other = List.copyOf(other);
    }
}
