package com.platform.configdrift.error;

/**
 * Standardized error codes for the drift monitor.
 * Each error has a unique code that clients can use to take specific actions.
 *
 * Format: CD-{CATEGORY}{NUMBER}
 * Categories:
 * - 1xx: Validation errors (bad request, bad snapshot, unknown engine)
 * - 3xx: Resource errors (snapshot or operation not found)
 * - 4xx: System errors (snapshot store, dashboard API)
 * - 9xx: Internal errors (unexpected)
 */
public enum ErrorCode {

    // ==================== Validation Errors (1xx) ====================

    VALIDATION_ERROR("CD-100", "Validation error", 400, ErrorCategory.RECOVERABLE),
    INVALID_SNAPSHOT("CD-101", "Snapshot root must be a map or a sequence", 422, ErrorCategory.RECOVERABLE),
    UNSUPPORTED_ENGINE("CD-102", "Unsupported comparison method", 400, ErrorCategory.RECOVERABLE),
    INVALID_FIELD_VALUE("CD-103", "Invalid field value", 400, ErrorCategory.RECOVERABLE),

    // ==================== Resource Errors (3xx) ====================

    SNAPSHOT_NOT_FOUND("CD-300", "Baseline snapshot not found", 404, ErrorCategory.RECOVERABLE),
    OPERATION_NOT_FOUND("CD-301", "Operation not found", 404, ErrorCategory.RECOVERABLE),

    // ==================== System Errors (4xx) ====================

    SNAPSHOT_STORE_ERROR("CD-400", "Snapshot store error", 500, ErrorCategory.FATAL),
    DASHBOARD_API_ERROR("CD-410", "Dashboard API error", 502, ErrorCategory.RECOVERABLE),
    DASHBOARD_UNAVAILABLE("CD-411", "Dashboard API unavailable", 503, ErrorCategory.RECOVERABLE),

    // ==================== Internal Errors (9xx) ====================

    UNEXPECTED_ERROR("CD-901", "Unexpected error occurred", 500, ErrorCategory.FATAL);

    private final String code;
    private final String defaultMessage;
    private final int httpStatus;
    private final ErrorCategory category;

    ErrorCode(String code, String defaultMessage, int httpStatus, ErrorCategory category) {
        this.code = code;
        this.defaultMessage = defaultMessage;
        this.httpStatus = httpStatus;
        this.category = category;
    }

    public String getCode() {
        return code;
    }

    public String getDefaultMessage() {
        return defaultMessage;
    }

    public int getHttpStatus() {
        return httpStatus;
    }

    public ErrorCategory getCategory() {
        return category;
    }

    public boolean isFatal() {
        return category == ErrorCategory.FATAL;
    }

    /**
     * Error category for distinguishing fatal vs recoverable errors.
     */
    public enum ErrorCategory {
        /**
         * The caller can retry or fix the request.
         */
        RECOVERABLE,

        /**
         * The service is misconfigured or its storage is broken.
         */
        FATAL
    }
}
