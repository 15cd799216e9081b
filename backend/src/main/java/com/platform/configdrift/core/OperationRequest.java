package com.platform.configdrift.core;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Input of {@link DriftOperationService#coreDataOperation}.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class OperationRequest {

    /**
     * organization_level, network_level or device_level.
     */
    private String scope;

    private String operationName;

    /**
     * store or compare.
     */
    private String task;

    /**
     * Entity whose state is stored as baseline: organization id, network id or device serial.
     */
    private String identifier;

    /**
     * Baseline snapshot file to compare against.
     */
    private String filename;

    /**
     * deepdiff, structural or flat; the configured default when null.
     */
    private String comparisonMethod;

    /**
     * Overrides the configured default organization.
     */
    private String organizationId;

    @Builder.Default
    private List<String> organizationIds = new ArrayList<>();

    @Builder.Default
    private List<String> networkTags = new ArrayList<>();

    @Builder.Default
    private List<String> deviceTags = new ArrayList<>();

    @Builder.Default
    private List<String> deviceModels = new ArrayList<>();

    @Builder.Default
    private List<String> productTypes = new ArrayList<>();
}
