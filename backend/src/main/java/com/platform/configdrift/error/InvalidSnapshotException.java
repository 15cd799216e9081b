package com.platform.configdrift.error;

/**
 * Thrown by the differs when a snapshot root is neither a map nor a sequence.
 */
public class InvalidSnapshotException extends DriftMonitorException {

    private final String side;

    public InvalidSnapshotException(String side, String nodeType) {
        super(ErrorCode.INVALID_SNAPSHOT,
            String.format("%s snapshot must be a map or a sequence, got %s", side, nodeType));
        this.side = side;
    }

    public String getSide() {
        return side;
    }
}
