package com.platform.configdrift.drift;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.classify.ComparisonSummary;
import com.platform.configdrift.entity.EntityFilter;
import com.platform.configdrift.entity.EntityRecord;
import com.platform.configdrift.observability.LoggingConfig;
import com.platform.configdrift.observability.MetricsRegistry;
import com.platform.configdrift.operation.DashboardContext;
import com.platform.configdrift.operation.OperationDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Compares one baseline against the live snapshot of every accepted entity.
 *
 * A failed fetch for one entity becomes an error entry for that entity; the run continues.
 */
@Slf4j
@Component
public class ComparisonOrchestrator {

    private final MetricsRegistry metricsRegistry;
    private final ComparisonProperties properties;

    public ComparisonOrchestrator(MetricsRegistry metricsRegistry, ComparisonProperties properties) {
        this.metricsRegistry = metricsRegistry;
        this.properties = properties;
    }

    /**
     * @return results keyed by entity display name, in entity order
     */
    public Map<String, EntityComparisonResult> compare(
            DashboardContext context,
            JsonNode baseline,
            List<EntityRecord> entities,
            OperationDescriptor descriptor,
            EntityFilter filter,
            ComparisonEngine engine) {

        EntityFilter effectiveFilter = filter != null ? filter : EntityFilter.acceptAll();
        List<EntityRecord> accepted = new ArrayList<>();
        for (EntityRecord entity : entities) {
            if (!entity.hasId()) {
                log.warn("Skipping entity '{}' without id", entity.displayName());
                continue;
            }
            if (!effectiveFilter.accept(entity)) {
                log.debug("Entity {} ({}) rejected by filter", entity.displayName(), entity.id());
                continue;
            }
            accepted.add(entity);
        }

        log.info("Comparing {} with {} of {} entities using {}", 
            descriptor.getName(), accepted.size(), entities.size(), engine.getMethod().getName());

        List<Optional<EntityComparisonResult>> outcomes = properties.getParallelism() > 1 && accepted.size() > 1
            ? compareInParallel(context, baseline, accepted, descriptor, engine)
            : accepted.stream().map(entity -> compareEntity(context, baseline, entity, descriptor, engine)).toList();

        Map<String, EntityComparisonResult> results = new LinkedHashMap<>();
        for (Optional<EntityComparisonResult> outcome : outcomes) {
            outcome.ifPresent(result -> {
                String key = result.entityName();
                if (results.containsKey(key)) {
                    key = key + " (" + result.entityId() + ")";
                }
                results.put(key, result);
            });
        }
        return results;
    }

    private List<Optional<EntityComparisonResult>> compareInParallel(
            DashboardContext context,
            JsonNode baseline,
            List<EntityRecord> entities,
            OperationDescriptor descriptor,
            ComparisonEngine engine) {

        int threads = Math.min(properties.getParallelism(), entities.size());
        ExecutorService executor = Executors.newFixedThreadPool(threads);
        Map<String, String> mdc = MDC.getCopyOfContextMap();
        try {
            List<Future<Optional<EntityComparisonResult>>> futures = new ArrayList<>();
            for (EntityRecord entity : entities) {
                futures.add(executor.submit(() -> {
                    if (mdc != null) {
                        MDC.setContextMap(mdc);
                    }
                    try {
                        return compareEntity(context, baseline, entity, descriptor, engine);
                    } finally {
                        MDC.clear();
                    }
                }));
            }

            List<Optional<EntityComparisonResult>> outcomes = new ArrayList<>();
            for (int i = 0; i < futures.size(); i++) {
                outcomes.add(awaitOutcome(futures.get(i), entities.get(i)));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private Optional<EntityComparisonResult> awaitOutcome(Future<Optional<EntityComparisonResult>> future,
                                                          EntityRecord entity) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.of(EntityComparisonResult.failed(entity.displayName(), entity.id(), "Comparison interrupted"));
        } catch (ExecutionException e) {
            log.error("Comparison task for {} failed", entity.displayName(), e.getCause());
            return Optional.of(EntityComparisonResult.failed(entity.displayName(), entity.id(), 
                String.valueOf(e.getCause().getMessage())));
        }
    }

    private Optional<EntityComparisonResult> compareEntity(
            DashboardContext context,
            JsonNode baseline,
            EntityRecord entity,
            OperationDescriptor descriptor,
            ComparisonEngine engine) {

        String name = entity.displayName();
        LoggingConfig.setEntityContext(name);
        try {
            JsonNode current;
            try {
                current = descriptor.fetch(context, entity.id());
            } catch (RuntimeException e) {
                log.error("Failed to fetch {} for {} ({}): {}", 
                    descriptor.getName(), name, entity.id(), e.getMessage());
                metricsRegistry.recordFetchFailure(descriptor.getName());
                return Optional.of(EntityComparisonResult.failed(name, entity.id(), e.getMessage()));
            }

            if (current == null || current.isMissingNode() || current.isNull()) {
                log.warn("No current data for {} ({}), skipping", name, entity.id());
                return Optional.empty();
            }

            long start = System.currentTimeMillis();
            ComparisonSummary summary = engine.compare(baseline, current, descriptor.getGroupingKey(), name);
            metricsRegistry.recordComparison(descriptor.getName(), engine.getMethod().getName(),
                summary.summaryCounts(), System.currentTimeMillis() - start);

            if (summary.hasDiffs()) {
                log.info("Drift detected for {}: {}", name, summary.summaryCounts());
            }
            return Optional.of(EntityComparisonResult.compared(name, entity.id(), summary));
        } finally {
            LoggingConfig.clearEntityContext();
        }
    }
}
