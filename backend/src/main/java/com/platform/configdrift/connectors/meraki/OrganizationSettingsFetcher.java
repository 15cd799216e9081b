package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.SnapshotFetcher;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Organization settings. Identity fields are stripped so one organization can serve as baseline for others.
 */
@Component
public class OrganizationSettingsFetcher implements SnapshotFetcher {

    private static final List<String> IDENTITY_FIELDS = List.of("id", "name", "url");

    @Override
    public JsonNode fetch(DashboardContext context, String entityId) {
        String organizationId = entityId != null ? entityId : context.requireOrganizationId();
        JsonNode settings = context.client().get(
            "organization " + organizationId, MerakiEndpoints.ORGANIZATION, organizationId);
        if (settings != null && settings.isObject()) {
            ((ObjectNode) settings).remove(IDENTITY_FIELDS);
        }
        return settings;
    }

    @Override
    public String getOperationName() {
        return "organization_settings";
    }
}
