package com.platform.configdrift.operation;

import com.fasterxml.jackson.annotation.JsonValue;
import com.platform.configdrift.error.ValidationException;

import java.util.Arrays;

/**
 * Level of the dashboard hierarchy an operation works on.
 */
public enum OperationScope {
    ORGANIZATION_LEVEL("organization_level", "Organization", "Organization_config", "id"),
    NETWORK_LEVEL("network_level", "Network", "Network_config", "id"),
    DEVICE_LEVEL("device_level", "Device", "Device_config", "serial");

    private final String name;
    private final String displayName;
    private final String folder;
    private final String idKey;

    OperationScope(String name, String displayName, String folder, String idKey) {
        this.name = name;
        this.displayName = displayName;
        this.folder = folder;
        this.idKey = idKey;
    }

    @JsonValue
    public String getName() {
        return name;
    }

    public String getDisplayName() {
        return displayName;
    }

    /**
     * Snapshot store folder for this scope.
     */
    public String getFolder() {
        return folder;
    }

    /**
     * Attribute holding the entity id in dashboard listings.
     */
    public String getIdKey() {
        return idKey;
    }

    public static OperationScope fromName(String name) {
        return Arrays.stream(values())
            .filter(scope -> scope.name.equalsIgnoreCase(name) || scope.name().equalsIgnoreCase(name))
            .findFirst()
            .orElseThrow(() -> new ValidationException("scope", name, "unknown operation scope"));
    }
}
