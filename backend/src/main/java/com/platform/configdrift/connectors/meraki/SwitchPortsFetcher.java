package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

/**
 * Port configuration of a switch, keyed by {@code portId}.
 */
@Component
public class SwitchPortsFetcher implements SnapshotFetcher {

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        return context.client().get("switch ports of device " + entityId, MerakiEndpoints.DEVICE_SWITCH_PORTS, entityId);
    }

    @Override
    public String getOperationName() {
        return "switchport_on_switch";
    }
}
