package com.platform.configdrift.operation;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * Fetches the live snapshot of one operation for one entity.
 */
public interface SnapshotFetcher {

    /**
     * Fetch the snapshot.
     *
     * @param context dashboard client and organization
     * @param entityId organization id, network id or device serial; null means the context's organization
     * @return the snapshot, or null when the dashboard returned nothing
     */
    JsonNode fetch(DashboardContext context, String entityId);

    /**
     * Name of the operation this fetcher serves, e.g. {@code network_ssids}.
     */
    String getOperationName();
}
