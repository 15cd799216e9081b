package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

/**
 * Organization administrators, without the volatile {@code lastActive} timestamp.
 */
@Component
public class OrganizationAdminsFetcher implements SnapshotFetcher {

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        String organizationId = entityId != null ? entityId : context.requireOrganizationId();
        JsonNode admins = context.client().get(
            "admins of organization " + organizationId, MerakiEndpoints.ORGANIZATION_ADMINS, organizationId);
        if (admins != null) {
            for (JsonNode admin : admins) {
                if (admin.isObject()) {
                    ((ObjectNode) admin).remove("lastActive");
                }
            }
        }
        return admins;
    }

    @Override
    public String getOperationName() {
        return "organization_admins";
    }
}
