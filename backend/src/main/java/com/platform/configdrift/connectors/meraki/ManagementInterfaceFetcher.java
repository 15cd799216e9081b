package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

/**
 * Management interface (WAN uplinks, VLAN, DNS) of an appliance.
 */
@Component
public class ManagementInterfaceFetcher implements SnapshotFetcher {

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        return context.client().get(
            "management interface of device " + entityId, MerakiEndpoints.DEVICE_MANAGEMENT_INTERFACE, entityId);
    }

    @Override
    public String getOperationName() {
        return "mx_management_interface";
    }
}
