package com.platform.configdrift.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.ComparisonSummary;

/**
 * Compares a baseline snapshot with a live one.
 */
public interface ComparisonEngine {

    /**
     * Compare two snapshots.
     *
     * @param groupingKey attribute identifying list elements, may be null
     * @param entityName used for logging only
     * @return the classified summary; empty when either snapshot is not a map or a sequence
     */
    ComparisonSummary compare(JsonNode baseline, JsonNode current, String groupingKey, String entityName);

    ComparisonMethod getMethod();
}
