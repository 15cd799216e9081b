package com.platform.configdrift.error;

import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Error body returned by the drift API.
 */
@Data
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ErrorResponse {

    /**
     * Error code, e.g. CD-300.
     */
    private String code;

    private String message;

    private String detail;

    private boolean fatal;

    private int status;

    private Instant timestamp;

    private String path;

    /**
     * Correlation id, matches the X-Correlation-ID response header.
     */
    private String traceId;

    private List<FieldError> fieldErrors;

    private Map<String, Object> metadata;

    @Data
    @Builder
    public static class FieldError {
        private String field;
        private String message;
        private Object rejectedValue;
    }

    public static ErrorResponse of(ErrorCode errorCode, String message, String path, String traceId) {
        return ErrorResponse.builder()
            .code(errorCode.getCode())
            .message(message != null ? message : errorCode.getDefaultMessage())
            .fatal(errorCode.isFatal())
            .status(errorCode.getHttpStatus())
            .timestamp(Instant.now())
            .path(path)
            .traceId(traceId)
            .build();
    }
}
