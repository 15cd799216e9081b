package com.platform.configdrift.core;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.platform.configdrift.drift.EntityComparisonResult;
import com.platform.configdrift.error.ErrorCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Outcome of a store or compare task. Exactly one of success, comparisons or error is set.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record OperationResult(
    Boolean success,
    String filename,
    Map<String, EntityComparisonResult> comparisons,
    String error,
    @JsonIgnore ErrorCode errorCode
) {

    public static OperationResult stored(String filename) {
        return new OperationResult(true, filename, null, null, null);
    }

    public static OperationResult compared(Map<String, EntityComparisonResult> comparisons) {
        return new OperationResult(null, null, Collections.unmodifiableMap(new LinkedHashMap<>(comparisons)), null, null);
    }

    public static OperationResult failed(ErrorCode errorCode, String error) {
        return new OperationResult(null, null, null, error, errorCode);
    }

    @JsonIgnore
    public boolean isError() {
        return error != null;
    }

    /**
     * Error code string, e.g. CD-300.
     */
    @JsonProperty("code")
    public String code() {
        return errorCode != null ? errorCode.getCode() : null;
    }
}
