package com.platform.configdrift.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.ComparisonSummary;
import com.platform.configdrift.classify.FlatClassifier;
import com.platform.configdrift.classify.FlatGrouping;
import com.platform.configdrift.classify.ListGrouper;
import com.platform.configdrift.diff.FlatComparison;
import com.platform.configdrift.diff.FlatDiffer;
import com.platform.configdrift.error.InvalidSnapshotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Flat key comparison. Lists of maps are first regrouped by the grouping key so that keys start with item ids.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FlatComparisonEngine implements ComparisonEngine {

    private final FlatDiffer differ;
    private final FlatClassifier classifier;

    @Override
    public ComparisonSummary compare(JsonNode baseline, JsonNode current, String groupingKey, String entityName) {
        JsonNode processedBaseline = baseline;
        JsonNode processedCurrent = current;
        boolean transformed = false;
        Set<String> topLevelIds = new LinkedHashSet<>();

        if (groupingKey != null && !groupingKey.isBlank()) {
            if (ListGrouper.isListOfMaps(baseline)) {
                processedBaseline = ListGrouper.groupByKey(baseline, groupingKey, "baseline");
                processedBaseline.fieldNames().forEachRemaining(topLevelIds::add);
                transformed = true;
            }
            if (ListGrouper.isListOfMaps(current)) {
                processedCurrent = ListGrouper.groupByKey(current, groupingKey, "current");
                processedCurrent.fieldNames().forEachRemaining(topLevelIds::add);
                transformed = true;
            }
        }

        FlatComparison flat;
        try {
            flat = differ.compare(processedBaseline, processedCurrent);
        } catch (InvalidSnapshotException e) {
            log.error("Cannot compare {}: {}", entityName, e.getMessage());
            return ComparisonSummary.empty();
        }

        FlatGrouping grouping = transformed ? new FlatGrouping(topLevelIds, processedBaseline, processedCurrent) : null;
        ComparisonSummary summary = classifier.summarize(flat, grouping);
        log.debug("Flat comparison for {} (grouped: {}): {}", entityName, transformed, summary.summaryCounts());
        return summary;
    }

    @Override
    public ComparisonMethod getMethod() {
        return ComparisonMethod.FLAT;
    }
}
