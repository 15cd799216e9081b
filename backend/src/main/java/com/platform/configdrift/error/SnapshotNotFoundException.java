package com.platform.configdrift.error;

/**
 * Thrown when a baseline snapshot file does not exist in the snapshot store.
 */
public class SnapshotNotFoundException extends ResourceNotFoundException {

    public SnapshotNotFoundException(String location) {
        super(ErrorCode.SNAPSHOT_NOT_FOUND, "Snapshot", location);
    }

    public SnapshotNotFoundException(String location, Throwable cause) {
        super(ErrorCode.SNAPSHOT_NOT_FOUND, "Snapshot", location, cause);
    }
}
