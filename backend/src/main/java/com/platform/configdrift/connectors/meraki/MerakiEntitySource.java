package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.entity.EntityRecord;
import com.platform.configdrift.entity.EntitySource;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.OperationScope;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Lists organizations, networks and devices from the dashboard.
 */
@Slf4j
@Component
public class MerakiEntitySource implements EntitySource {

    @Override
    public List<EntityRecord> listEntities(DashboardContext context, OperationScope scope, boolean acrossOrganizations) {
        return switch (scope) {
            case ORGANIZATION_LEVEL -> listOrganizations(context);
            case NETWORK_LEVEL -> listPerOrganization(context, acrossOrganizations, this::listNetworks);
            case DEVICE_LEVEL -> listPerOrganization(context, acrossOrganizations, this::listDevices);
        };
    }

    private List<EntityRecord> listOrganizations(DashboardContext context) {
        JsonNode organizations = context.client().get("organizations", MerakiEndpoints.ORGANIZATIONS);
        List<EntityRecord> records = new ArrayList<>();
        if (organizations != null) {
            for (JsonNode organization : organizations) {
                records.add(EntityRecord.organization(text(organization, "id"), text(organization, "name")));
            }
        }
        log.info("Listed {} organizations", records.size());
        return records;
    }

    private List<EntityRecord> listPerOrganization(DashboardContext context, boolean acrossOrganizations,
                                                   OrganizationLister lister) {
        if (!acrossOrganizations) {
            return lister.list(context, context.requireOrganizationId());
        }
        List<EntityRecord> records = new ArrayList<>();
        for (EntityRecord organization : listOrganizations(context)) {
            records.addAll(lister.list(context, organization.id()));
        }
        return records;
    }

    private List<EntityRecord> listNetworks(DashboardContext context, String organizationId) {
        JsonNode networks = context.client().getAllPages(
            "networks of organization " + organizationId, MerakiEndpoints.ORGANIZATION_NETWORKS, organizationId);
        List<EntityRecord> records = new ArrayList<>();
        for (JsonNode network : networks) {
            records.add(EntityRecord.network(
                text(network, "id"),
                text(network, "name"),
                texts(network.get("tags")),
                texts(network.get("productTypes"))));
        }
        log.info("Listed {} networks for organization {}", records.size(), organizationId);
        return records;
    }

    private List<EntityRecord> listDevices(DashboardContext context, String organizationId) {
        JsonNode devices = context.client().getAllPages(
            "devices of organization " + organizationId, MerakiEndpoints.ORGANIZATION_DEVICES, organizationId);
        List<EntityRecord> records = new ArrayList<>();
        for (JsonNode device : devices) {
            records.add(EntityRecord.device(
                text(device, "serial"),
                text(device, "name"),
                texts(device.get("tags")),
                text(device, "productType"),
                text(device, "model"),
                text(device, "networkId")));
        }
        log.info("Listed {} devices for organization {}", records.size(), organizationId);
        return records;
    }

    private static String text(JsonNode node, String field) {
        JsonNode value = node.get(field);
        return value == null || value.isNull() ? null : value.asText();
    }

    private static List<String> texts(JsonNode array) {
        List<String> values = new ArrayList<>();
        if (array != null && array.isArray()) {
            array.forEach(value -> values.add(value.asText()));
        }
        return values;
    }

    @FunctionalInterface
    private interface OrganizationLister {
        List<EntityRecord> list(DashboardContext context, String organizationId);
    }
}
