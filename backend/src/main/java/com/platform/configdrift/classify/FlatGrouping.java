package com.platform.configdrift.classify;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Set;

/**
 * Context of a flat comparison whose inputs were regrouped by key: the top-level ids and both processed trees.
 */
public record FlatGrouping(Set<String> topLevelItemIds, JsonNode processedBaseline, JsonNode processedCurrent) {

    public FlatGrouping {
        topLevelItemIds = Set.copyOf(topLevelItemIds);
    }
}
