package com.platform.configdrift.observability;

import com.platform.configdrift.classify.SummaryCounts;
import com.platform.configdrift.error.ErrorCode;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Central registry for drift monitor metrics.
 * Counters for snapshots, comparisons, classified changes and errors; a timer for comparison latency.
 */
@Slf4j
@Component
public class MetricsRegistry {

    private final MeterRegistry meterRegistry;
    private final Map<String, Counter> counters;
    private final Map<String, Timer> timers;

    public MetricsRegistry(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
        this.counters = new ConcurrentHashMap<>();
        this.timers = new ConcurrentHashMap<>();
        log.info("Metrics registry initialized");
    }

    /**
     * Record a baseline snapshot written to the store.
     */
    public void recordSnapshotStored(String scope, String operation) {
        incrementCounter("configdrift.snapshot.stored", "scope", scope, "operation", operation);
    }

    /**
     * Record one entity comparison and the changes it classified.
     */
    public void recordComparison(String operation, String method, SummaryCounts counts, long latencyMs) {
        String result = counts.total() > 0 ? "drift" : "clean";
        incrementCounter("configdrift.comparison.entities", 
            "operation", operation, "method", method, "result", result);

        incrementCounter("configdrift.comparison.changes", counts.added(), "operation", operation, "status", "added");
        incrementCounter("configdrift.comparison.changes", counts.removed(), "operation", operation, "status", "removed");
        incrementCounter("configdrift.comparison.changes", counts.changed(), "operation", operation, "status", "changed");
        incrementCounter("configdrift.comparison.changes", counts.other(), "operation", operation, "status", "other");

        recordLatency(operation, method, latencyMs);
        log.debug("Recorded comparison for {} via {}: {} ({}ms)", operation, method, result, latencyMs);
    }

    /**
     * Record a failed live fetch for one entity.
     */
    public void recordFetchFailure(String operation) {
        incrementCounter("configdrift.fetch.failure", "operation", operation);
    }

    /**
     * Record an error surfaced to a caller.
     */
    public void recordError(ErrorCode errorCode) {
        incrementCounter("configdrift.errors", 
            "code", errorCode.getCode(), 
            "category", errorCode.getCategory().name());
    }

    /**
     * Record latency of a single comparison.
     */
    public void recordLatency(String operation, String method, long latencyMs) {
        String timerKey = operation + "." + method;
        Timer timer = timers.computeIfAbsent(timerKey, k -> 
            Timer.builder("configdrift.comparison.latency")
                .tag("operation", operation)
                .tag("method", method)
                .publishPercentiles(0.5, 0.95, 0.99)
                .register(meterRegistry));

        timer.record(Duration.ofMillis(latencyMs));
    }

    /**
     * Increment a counter with tags.
     */
    public void incrementCounter(String name, String... tags) {
        incrementCounter(name, 1, tags);
    }

    private void incrementCounter(String name, double amount, String... tags) {
        if (amount <= 0) {
            return;
        }
        String key = name + String.join(".", tags);
        counters.computeIfAbsent(key, k -> 
            Counter.builder(name)
                .tags(tags)
                .register(meterRegistry))
            .increment(amount);
    }
}
