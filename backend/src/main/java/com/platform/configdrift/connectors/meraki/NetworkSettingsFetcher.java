package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

@Component
public class NetworkSettingsFetcher implements SnapshotFetcher {

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        return context.client().get("settings of network " + entityId, MerakiEndpoints.NETWORK_SETTINGS, entityId);
    }

    @Override
    public String getOperationName() {
        return "network_settings";
    }
}
