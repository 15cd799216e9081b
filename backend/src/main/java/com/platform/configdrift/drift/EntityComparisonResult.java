package com.platform.configdrift.drift;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.platform.configdrift.classify.ComparisonSummary;

/**
 * Outcome for one entity: a summary, or the error that prevented the comparison.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record EntityComparisonResult(
    String entityName,
    String entityId,
    ComparisonSummary summary,
    String error
) {

    public static EntityComparisonResult compared(String entityName, String entityId, ComparisonSummary summary) {
        return new EntityComparisonResult(entityName, entityId, summary, null);
    }

    public static EntityComparisonResult failed(String entityName, String entityId, String error) {
        return new EntityComparisonResult(entityName, entityId, null, error);
    }

    @JsonIgnore
    public boolean isFailed() {
        return error != null;
    }
}
