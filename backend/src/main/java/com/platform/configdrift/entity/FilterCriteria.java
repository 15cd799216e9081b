package com.platform.configdrift.entity;

import java.util.List;

/**
 * Allow-lists supplied with a comparison request. Empty lists do not filter.
 */
public record FilterCriteria(
    List<String> organizationIds,
    List<String> networkTags,
    List<String> deviceTags,
    List<String> deviceModels,
    List<String> productTypes
) {

    public FilterCriteria {
        organizationIds = normalize(organizationIds);
        networkTags = normalize(networkTags);
        deviceTags = normalize(deviceTags);
        deviceModels = normalize(deviceModels);
        productTypes = normalize(productTypes);
    }

    public static FilterCriteria none() {
        return new FilterCriteria(null, null, null, null, null);
    }

    public boolean hasNetworkTags() {
        return !networkTags.isEmpty();
    }

    private static List<String> normalize(List<String> values) {
        if (values == null) {
            return List.of();
        }
        return values.stream()
            .filter(value -> value != null && !value.isBlank())
            .map(String::trim)
            .toList();
    }
}
