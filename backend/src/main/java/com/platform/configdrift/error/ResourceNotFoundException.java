package com.platform.configdrift.error;

/**
 * Exception for lookups of snapshots or operations that do not exist.
 */
public class ResourceNotFoundException extends DriftMonitorException {

    private final String resourceType;
    private final String resourceId;

    public ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId));
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    protected ResourceNotFoundException(ErrorCode errorCode, String resourceType, String resourceId, Throwable cause) {
        super(errorCode, String.format("%s not found: %s", resourceType, resourceId), cause);
        this.resourceType = resourceType;
        this.resourceId = resourceId;
    }

    public static ResourceNotFoundException operation(String scope, String operationName) {
        return new ResourceNotFoundException(ErrorCode.OPERATION_NOT_FOUND, "Operation", scope + "/" + operationName);
    }

    public String getResourceType() {
        return resourceType;
    }

    public String getResourceId() {
        return resourceId;
    }
}
