package com.platform.configdrift.operation;

import com.platform.configdrift.connectors.meraki.MerakiDashboardClient;
import com.platform.configdrift.error.ValidationException;

/**
 * Dashboard client and organization a drift run works against. Passed explicitly to fetchers and entity sources.
 */
public record DashboardContext(String organizationId, MerakiDashboardClient client) {

    public boolean hasOrganization() {
        return organizationId != null && !organizationId.isBlank();
    }

    public String requireOrganizationId() {
        if (!hasOrganization()) {
            throw new ValidationException("Organization ID is not set. Configure configdrift.meraki.organization-id or pass organizationId.");
        }
        return organizationId;
    }

    public DashboardContext withOrganization(String otherOrganizationId) {
        return new DashboardContext(otherOrganizationId, client);
    }
}
