package com.platform.configdrift.classify;

import com.platform.configdrift.diff.DiffEvent;

import java.util.List;

/**
 * Classified outcome of comparing one live snapshot against the baseline.
 */
public record ComparisonSummary(
        List<EntityChange> relevantChanges,
        List<OtherChange> otherChanges,
        List<DiffEvent> rawDiff,
        SummaryCounts summaryCounts,
        boolean hasDiffs) {

    public ComparisonSummary {
        relevantChanges = List.copyOf(relevantChanges);
        otherChanges = List.copyOf(otherChanges);
        rawDiff = List.copyOf(rawDiff);
    }

    public static ComparisonSummary empty() {
        return new ComparisonSummary(List.of(), List.of(), List.of(), SummaryCounts.ZERO, false);
    }

    public static ComparisonSummary of(List<EntityChange> relevant, List<OtherChange> other, List<DiffEvent> rawDiff) {
        SummaryCounts counts = SummaryCounts.of(relevant, other.size());
        return new ComparisonSummary(relevant, other, rawDiff, counts, counts.total() > 0);
    }
}
