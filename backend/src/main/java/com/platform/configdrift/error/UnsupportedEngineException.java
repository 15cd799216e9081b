package com.platform.configdrift.error;

/**
 * Thrown when a comparison method name does not match any registered engine.
 */
public class UnsupportedEngineException extends DriftMonitorException {

    private final String methodName;

    public UnsupportedEngineException(String methodName) {
        super(ErrorCode.UNSUPPORTED_ENGINE, "Unsupported comparison method: " + methodName);
        this.methodName = methodName;
    }

    public String getMethodName() {
        return methodName;
    }
}
