package com.platform.configdrift.diff;

import java.util.List;

/**
 * Result of a flat comparison, changes ordered by key.
 */
public record FlatComparison(boolean hasChanges, List<FlatChange> detailedChanges) {

    public FlatComparison {
        detailedChanges = List.copyOf(detailedChanges);
    }

    public static FlatComparison empty() {
        return new FlatComparison(false, List.of());
    }
}
