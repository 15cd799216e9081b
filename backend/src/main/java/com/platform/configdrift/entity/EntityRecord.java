package com.platform.configdrift.entity;

import java.util.List;

/**
 * An organization, network or device as listed by the dashboard.
 */
public record EntityRecord(
    String id,
    String name,
    List<String> tags,
    List<String> productTypes,
    String model,
    String networkId
) {

    public EntityRecord {
        tags = tags == null ? List.of() : List.copyOf(tags);
        productTypes = productTypes == null ? List.of() : List.copyOf(productTypes);
    }

    public static EntityRecord organization(String id, String name) {
        return new EntityRecord(id, name, List.of(), List.of(), null, null);
    }

    public static EntityRecord network(String id, String name, List<String> tags, List<String> productTypes) {
        return new EntityRecord(id, name, tags, productTypes, null, null);
    }

    public static EntityRecord device(String serial, String name, List<String> tags, String productType,
                                      String model, String networkId) {
        return new EntityRecord(serial, name, tags, productType == null ? List.of() : List.of(productType),
            model, networkId);
    }

    public String displayName() {
        return name == null || name.isBlank() ? "Unknown" : name;
    }

    public boolean hasId() {
        return id != null && !id.isBlank();
    }
}
