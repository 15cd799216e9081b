package com.platform.configdrift.error;

/**
 * Exception for failed live fetches from the dashboard API.
 */
public class FetchFailureException extends DriftMonitorException {

    private final String source;
    private final String resource;

    public FetchFailureException(String source, String resource, String message) {
        super(ErrorCode.DASHBOARD_API_ERROR, message);
        this.source = source;
        this.resource = resource;
    }

    public FetchFailureException(ErrorCode errorCode, String source, String resource, String message, Throwable cause) {
        super(errorCode, message, cause);
        this.source = source;
        this.resource = resource;
    }

    public static FetchFailureException meraki(String resource, Throwable cause) {
        return new FetchFailureException(
            ErrorCode.DASHBOARD_API_ERROR,
            "meraki",
            resource,
            String.format("Meraki API error for %s: %s", resource, cause.getMessage()),
            cause
        );
    }

    public static FetchFailureException unavailable(String resource, Throwable cause) {
        return new FetchFailureException(
            ErrorCode.DASHBOARD_UNAVAILABLE,
            "meraki",
            resource,
            String.format("Meraki API unreachable for %s: %s", resource, cause.getMessage()),
            cause
        );
    }

    public String getSource() {
        return source;
    }

    public String getResource() {
        return resource;
    }
}
