package com.platform.configdrift.error;

/**
 * Exception for snapshot files that cannot be written or parsed.
 */
public class SnapshotStoreException extends DriftMonitorException {

    private final String location;

    public SnapshotStoreException(String location, String message, Throwable cause) {
        super(ErrorCode.SNAPSHOT_STORE_ERROR, message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
