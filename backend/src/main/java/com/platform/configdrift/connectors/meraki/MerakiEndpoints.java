package com.platform.configdrift.connectors.meraki;

/**
 * Dashboard API v1 URI templates, relative to the base URL.
 */
final class MerakiEndpoints {

    static final String ORGANIZATIONS = "/organizations";
    static final String ORGANIZATION = "/organizations/{organizationId}";
    static final String ORGANIZATION_ADMINS = "/organizations/{organizationId}/admins";
    static final String ORGANIZATION_NETWORKS = "/organizations/{organizationId}/networks";
    static final String ORGANIZATION_DEVICES = "/organizations/{organizationId}/devices";
    static final String NETWORK_SETTINGS = "/networks/{networkId}/settings";
    static final String NETWORK_WIRELESS_SSIDS = "/networks/{networkId}/wireless/ssids";
    static final String DEVICE_SWITCH_PORTS = "/devices/{serial}/switch/ports";
    static final String DEVICE_MANAGEMENT_INTERFACE = "/devices/{serial}/managementInterface";

    private MerakiEndpoints() {
    }
}
