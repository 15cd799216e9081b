package com.platform.configdrift.store;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.operation.OperationDescriptor;

import java.util.List;

/**
 * Persistent storage of baseline snapshots.
 */
public interface SnapshotStore {

    /**
     * Store a snapshot as a new timestamped file.
     *
     * @return the file name, without directories
     */
    String save(OperationDescriptor descriptor, JsonNode snapshot);

    /**
     * Load a stored snapshot.
     *
     * @throws com.platform.configdrift.error.SnapshotNotFoundException if the file does not exist
     */
    JsonNode load(String scopeFolder, String operationFolder, String filename);

    default JsonNode load(OperationDescriptor descriptor, String filename) {
        return load(descriptor.getScope().getFolder(), descriptor.getFolder(), filename);
    }

    /**
     * File names of stored snapshots of an operation, sorted ascending; empty when none were stored.
     */
    List<String> listSnapshots(OperationDescriptor descriptor);
}
