package com.platform.configdrift.error;

/**
 * Base exception for all drift monitor exceptions.
 * Carries an ErrorCode so that callers can turn it into a structured error value.
 */
public abstract class DriftMonitorException extends RuntimeException {

    private final ErrorCode errorCode;

    protected DriftMonitorException(ErrorCode errorCode) {
        super(errorCode.getDefaultMessage());
        this.errorCode = errorCode;
    }

    protected DriftMonitorException(ErrorCode errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected DriftMonitorException(ErrorCode errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public ErrorCode getErrorCode() {
        return errorCode;
    }

    public boolean isFatal() {
        return errorCode.isFatal();
    }
}
