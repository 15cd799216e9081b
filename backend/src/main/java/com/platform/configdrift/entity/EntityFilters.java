package com.platform.configdrift.entity;

import com.platform.configdrift.operation.OperationDescriptor;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Filter predicates per scope.
 */
public final class EntityFilters {

    private EntityFilters() {
    }

    /**
     * Builds the filter for the descriptor's scope.
     *
     * @param networkTagsById tags of each network by id, only used to filter devices by network tags
     */
    public static EntityFilter forScope(OperationDescriptor descriptor, FilterCriteria criteria,
                                        Map<String, List<String>> networkTagsById) {
        return switch (descriptor.getScope()) {
            case ORGANIZATION_LEVEL -> forOrganizations(criteria.organizationIds());
            case NETWORK_LEVEL -> forNetworks(criteria.networkTags(), descriptor.getProductType());
            case DEVICE_LEVEL -> forDevices(criteria, descriptor.getProductType(), networkTagsById);
        };
    }

    public static EntityFilter forOrganizations(List<String> organizationIds) {
        if (organizationIds.isEmpty()) {
            return EntityFilter.acceptAll();
        }
        return organization -> organizationIds.contains(organization.id());
    }

    /**
     * Networks must carry one of the tags (when given) and support the operation's product type (when set).
     */
    public static EntityFilter forNetworks(List<String> networkTags, String productType) {
        return network -> {
            if (!networkTags.isEmpty() && !anyMatch(network.tags(), networkTags)) {
                return false;
            }
            return productType == null || network.productTypes().contains(productType);
        };
    }

    /**
     * Devices must match every supplied allow-list. Without a product-type allow-list the operation's
     * product type, when set, is required instead.
     */
    public static EntityFilter forDevices(FilterCriteria criteria, String operationProductType,
                                          Map<String, List<String>> networkTagsById) {
        return device -> {
            if (!criteria.deviceTags().isEmpty() && !anyMatch(device.tags(), criteria.deviceTags())) {
                return false;
            }
            if (!criteria.deviceModels().isEmpty() && !criteria.deviceModels().contains(device.model())) {
                return false;
            }
            if (!criteria.productTypes().isEmpty()) {
                if (!anyMatch(device.productTypes(), criteria.productTypes())) {
                    return false;
                }
            } else if (operationProductType != null && !device.productTypes().contains(operationProductType)) {
                return false;
            }
            if (criteria.hasNetworkTags()) {
                List<String> networkTags = networkTagsById.getOrDefault(device.networkId(), List.of());
                return anyMatch(networkTags, criteria.networkTags());
            }
            return true;
        };
    }

    private static boolean anyMatch(Collection<String> values, Collection<String> allowed) {
        return values.stream().anyMatch(allowed::contains);
    }
}
