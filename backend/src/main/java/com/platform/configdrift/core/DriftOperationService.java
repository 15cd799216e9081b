package com.platform.configdrift.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.connectors.meraki.MerakiDashboardClient;
import com.platform.configdrift.connectors.meraki.MerakiProperties;
import com.platform.configdrift.drift.ComparisonEngine;
import com.platform.configdrift.drift.ComparisonEngineRegistry;
import com.platform.configdrift.drift.ComparisonOrchestrator;
import com.platform.configdrift.drift.ComparisonProperties;
import com.platform.configdrift.drift.EntityComparisonResult;
import com.platform.configdrift.entity.EntityFilter;
import com.platform.configdrift.entity.EntityFilters;
import com.platform.configdrift.entity.EntityRecord;
import com.platform.configdrift.entity.EntitySource;
import com.platform.configdrift.entity.FilterCriteria;
import com.platform.configdrift.error.DriftMonitorException;
import com.platform.configdrift.error.ErrorCode;
import com.platform.configdrift.error.FetchFailureException;
import com.platform.configdrift.error.ValidationException;
import com.platform.configdrift.observability.LoggingConfig;
import com.platform.configdrift.observability.MetricsRegistry;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.OperationDescriptor;
import com.platform.configdrift.operation.OperationRegistry;
import com.platform.configdrift.operation.OperationScope;
import com.platform.configdrift.store.SnapshotStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Entry point for store and compare tasks.
 *
 * Failures come back as {@link OperationResult#failed} values; this service does not throw for them.
 */
@Slf4j
@Service
public class DriftOperationService {

    private final OperationRegistry operationRegistry;
    private final SnapshotStore snapshotStore;
    private final EntitySource entitySource;
    private final ComparisonOrchestrator orchestrator;
    private final ComparisonEngineRegistry engineRegistry;
    private final ComparisonProperties comparisonProperties;
    private final MerakiDashboardClient dashboardClient;
    private final MerakiProperties merakiProperties;
    private final MetricsRegistry metricsRegistry;

    public DriftOperationService(
            OperationRegistry operationRegistry,
            SnapshotStore snapshotStore,
            EntitySource entitySource,
            ComparisonOrchestrator orchestrator,
            ComparisonEngineRegistry engineRegistry,
            ComparisonProperties comparisonProperties,
            MerakiDashboardClient dashboardClient,
            MerakiProperties merakiProperties,
            MetricsRegistry metricsRegistry) {
        this.operationRegistry = operationRegistry;
        this.snapshotStore = snapshotStore;
        this.entitySource = entitySource;
        this.orchestrator = orchestrator;
        this.engineRegistry = engineRegistry;
        this.comparisonProperties = comparisonProperties;
        this.dashboardClient = dashboardClient;
        this.merakiProperties = merakiProperties;
        this.metricsRegistry = metricsRegistry;
    }

    /**
     * Store the live state of one entity as baseline, or compare all entities of the scope against a baseline.
     */
    public OperationResult coreDataOperation(OperationRequest request) {
        String task = request.getTask();
        String operationName = request.getOperationName();
        LoggingConfig.setOperationContext(String.valueOf(request.getScope()), String.valueOf(operationName));

        try {
            OperationScope scope = OperationScope.fromName(request.getScope());
            OperationDescriptor descriptor = operationRegistry.get(scope, operationName);
            DashboardContext context = createContext(request.getOrganizationId());

            return switch (OperationTask.fromName(task)) {
                case STORE -> store(context, descriptor, request.getIdentifier());
                case COMPARE -> compare(context, descriptor, request);
            };
        } catch (DriftMonitorException e) {
            log.error("{} failed for {}: {}", task, operationName, e.getMessage());
            metricsRegistry.recordError(e.getErrorCode());
            return OperationResult.failed(e.getErrorCode(), 
                String.format("%s during %s for %s: %s", e.getErrorCode().getDefaultMessage(), task, operationName, e.getMessage()));
        } catch (RuntimeException e) {
            log.error("Unexpected error during {} for {}", task, operationName, e);
            metricsRegistry.recordError(ErrorCode.UNEXPECTED_ERROR);
            return OperationResult.failed(ErrorCode.UNEXPECTED_ERROR,
                String.format("Unexpected error during %s for %s: %s", task, operationName, e.getMessage()));
        } finally {
            LoggingConfig.clearOperationContext();
        }
    }

    private OperationResult store(DashboardContext context, OperationDescriptor descriptor, String identifier) {
        log.info("Storing {} snapshot for {}", descriptor.getName(), identifier != null ? identifier : "default organization");

        JsonNode snapshot = descriptor.fetch(context, identifier);
        if (snapshot == null || snapshot.isMissingNode() || snapshot.isNull()) {
            throw new FetchFailureException("meraki", descriptor.getName(), "No data returned for " + descriptor.getName());
        }

        String filename = snapshotStore.save(descriptor, snapshot);
        metricsRegistry.recordSnapshotStored(descriptor.getScope().getName(), descriptor.getName());
        return OperationResult.stored(filename);
    }

    private OperationResult compare(DashboardContext context, OperationDescriptor descriptor, OperationRequest request) {
        if (request.getFilename() == null || request.getFilename().isBlank()) {
            throw new ValidationException("filename", request.getFilename(), "a baseline snapshot is required for compare");
        }
        String method = request.getComparisonMethod() != null && !request.getComparisonMethod().isBlank()
            ? request.getComparisonMethod()
            : comparisonProperties.getDefaultMethod();
        ComparisonEngine engine = engineRegistry.getEngine(method);

        JsonNode baseline = snapshotStore.load(descriptor, request.getFilename());

        FilterCriteria criteria = new FilterCriteria(
            request.getOrganizationIds(),
            request.getNetworkTags(),
            request.getDeviceTags(),
            request.getDeviceModels(),
            request.getProductTypes());

        List<EntityRecord> entities = entitySource.listEntities(context, descriptor.getScope());
        EntityFilter filter = EntityFilters.forScope(descriptor, criteria, networkTagsById(context, descriptor, criteria));

        Map<String, EntityComparisonResult> comparisons = 
            orchestrator.compare(context, baseline, entities, descriptor, filter, engine);

        log.info("Compared {} against {}: {} results", descriptor.getName(), request.getFilename(), comparisons.size());
        return OperationResult.compared(comparisons);
    }

    /**
     * Tags of every network, needed only when devices are filtered by the tags of their network.
     */
    private Map<String, List<String>> networkTagsById(DashboardContext context, OperationDescriptor descriptor,
                                                      FilterCriteria criteria) {
        if (descriptor.getScope() != OperationScope.DEVICE_LEVEL || !criteria.hasNetworkTags()) {
            return Map.of();
        }
        return entitySource.listEntities(context, OperationScope.NETWORK_LEVEL).stream()
            .filter(EntityRecord::hasId)
            .collect(Collectors.toMap(EntityRecord::id, EntityRecord::tags, (first, second) -> first));
    }

    private DashboardContext createContext(String organizationId) {
        String effective = organizationId != null && !organizationId.isBlank()
            ? organizationId
            : merakiProperties.getOrganizationId();
        return new DashboardContext(effective, dashboardClient);
    }

    /**
     * Stored baseline file names of an operation.
     */
    public List<String> listSnapshots(String scopeName, String operationName) {
        OperationDescriptor descriptor = operationRegistry.get(OperationScope.fromName(scopeName), operationName);
        return snapshotStore.listSnapshots(descriptor);
    }
}
