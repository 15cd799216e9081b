package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

@Component
public class NetworkSsidsFetcher implements SnapshotFetcher {

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        return context.client().get("SSIDs of network " + entityId, MerakiEndpoints.NETWORK_WIRELESS_SSIDS, entityId);
    }

    @Override
    public String getOperationName() {
        return "network_ssids";
    }
}
