package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.diff.FlatChange;
import com.platform.configdrift.diff.FlatComparison;
import com.platform.configdrift.diff.FlatDiffer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Groups flat changes into per-item changes using the top-level ids of regrouped input.
 */
@Slf4j
@Component
public class FlatClassifier {

    public static final String GLOBAL_ITEM = "Global Configuration";

    public ComparisonSummary summarize(FlatComparison flat) {
        return summarize(flat, null);
    }

    /**
     * @param grouping null when neither input was regrouped; every change then belongs to {@value #GLOBAL_ITEM}
     */
    public ComparisonSummary summarize(FlatComparison flat, FlatGrouping grouping) {
        List<String> ids = grouping == null ? List.of() : grouping.topLevelItemIds().stream()
            .sorted(Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder()))
            .toList();

        Map<String, ChangeStatus> statuses = new LinkedHashMap<>();
        Map<String, List<FieldChange>> changesById = new LinkedHashMap<>();

        for (FlatChange change : flat.detailedChanges()) {
            String itemId = GLOBAL_ITEM;
            String field = change.key();
            for (String id : ids) {
                if (change.key().equals(id)) {
                    itemId = id;
                    field = null;
                    break;
                }
                if (change.key().startsWith(id + FlatDiffer.SEPARATOR)) {
                    itemId = id;
                    field = change.key().substring(id.length() + FlatDiffer.SEPARATOR.length());
                    break;
                }
            }
            if (grouping != null && GLOBAL_ITEM.equals(itemId) && !ids.isEmpty()) {
                log.warn("Flat key '{}' matches no top-level item, reporting under {}", change.key(), GLOBAL_ITEM);
            }

            statuses.merge(itemId, change.status(), ChangeStatus::escalate);
            changesById.computeIfAbsent(itemId, k -> new ArrayList<>())
                .add(new FieldChange(field, change.referenceValue(), change.currentValue()));
        }

        List<EntityChange> relevant = new ArrayList<>();
        statuses.forEach((itemId, status) -> {
            List<FieldChange> changes = changesById.get(itemId);
            if (grouping != null && status.isWholeItem() && !GLOBAL_ITEM.equals(itemId)) {
                changes = wholeItemChanges(itemId, status, changes, grouping);
            }
            relevant.add(new EntityChange(itemId, status, changes));
        });

        SummaryCounts counts = SummaryCounts.of(relevant, 0);
        return new ComparisonSummary(relevant, List.of(), List.of(), counts, flat.hasChanges());
    }

    private List<FieldChange> wholeItemChanges(String itemId, ChangeStatus status, List<FieldChange> changes,
                                               FlatGrouping grouping) {
        JsonNode source = status == ChangeStatus.ADDED ? grouping.processedCurrent() : grouping.processedBaseline();
        JsonNode full = source != null && source.isObject() ? source.get(itemId) : null;
        if (full == null) {
            log.warn("Could not find full item '{}' for {} status, keeping flat changes", itemId, status.getValue());
            return changes;
        }
        return status == ChangeStatus.ADDED
            ? List.of(new FieldChange(null, FieldChange.NOT_AVAILABLE, full))
            : List.of(new FieldChange(null, full, FieldChange.NOT_AVAILABLE));
    }
}
