package com.platform.configdrift.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.Classification;
import com.platform.configdrift.classify.ComparisonSummary;
import com.platform.configdrift.classify.DiffClassifier;
import com.platform.configdrift.diff.DiffEvent;
import com.platform.configdrift.diff.StructuralDiffer;
import com.platform.configdrift.error.InvalidSnapshotException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;

@Slf4j
@Component
@RequiredArgsConstructor
public class StructuralComparisonEngine implements ComparisonEngine {

    private final StructuralDiffer differ;
    private final DiffClassifier classifier;

    @Override
    public ComparisonSummary compare(JsonNode baseline, JsonNode current, String groupingKey, String entityName) {
        List<DiffEvent> events;
        try {
            events = differ.diff(baseline, current, groupingKey);
        } catch (InvalidSnapshotException e) {
            log.error("Cannot compare {}: {}", entityName, e.getMessage());
            return ComparisonSummary.empty();
        }

        Classification classification = classifier.classify(events);
        ComparisonSummary summary = classifier.summarize(classification, events);
        log.debug("Structural comparison for {}: {}", entityName, summary.summaryCounts());
        return summary;
    }

    @Override
    public ComparisonMethod getMethod() {
        return ComparisonMethod.STRUCTURAL;
    }
}
