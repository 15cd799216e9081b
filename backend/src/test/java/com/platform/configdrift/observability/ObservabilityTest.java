package com.platform.configdrift.observability;

import com.platform.configdrift.classify.SummaryCounts;
import com.platform.configdrift.error.ErrorCode;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;
import org.springframework.mock.web.MockHttpServletRequest;
import org.springframework.mock.web.MockHttpServletResponse;

import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;

class ObservabilityTest {

    private final SimpleMeterRegistry meterRegistry = new SimpleMeterRegistry();
    private final MetricsRegistry metrics = new MetricsRegistry(meterRegistry);

    @Test
    void correlationIdIsPropagatedAndCleared() throws Exception {
        MockHttpServletRequest request = new MockHttpServletRequest("GET", "/api/drift/scopes");
        request.addHeader(LoggingConfig.CorrelationIdFilter.CORRELATION_ID_HEADER, "abc-123");
        MockHttpServletResponse response = new MockHttpServletResponse();
        AtomicReference<String> seen = new AtomicReference<>();

        new LoggingConfig.CorrelationIdFilter().doFilter(request, response,
                (req, res) -> seen.set(MDC.get("correlationId")));

        assertThat(seen.get()).isEqualTo("abc-123");
        assertThat(response.getHeader(LoggingConfig.CorrelationIdFilter.CORRELATION_ID_HEADER)).isEqualTo("abc-123");
        assertThat(MDC.get("correlationId")).isNull();
    }

    @Test
    void missingCorrelationIdIsGenerated() throws Exception {
        MockHttpServletResponse response = new MockHttpServletResponse();

        new LoggingConfig.CorrelationIdFilter().doFilter(new MockHttpServletRequest(), response, (req, res) -> { });

        assertThat(response.getHeader(LoggingConfig.CorrelationIdFilter.CORRELATION_ID_HEADER)).isNotBlank();
    }

    @Test
    void comparisonCountsChangesByStatus() {
        metrics.recordComparison("network_ssids", "flat", new SummaryCounts(2, 0, 1, 0), 12);
        metrics.recordComparison("network_ssids", "flat", SummaryCounts.ZERO, 3);

        assertThat(meterRegistry.counter("configdrift.comparison.changes",
                "operation", "network_ssids", "status", "added").count()).isEqualTo(2.0);
        assertThat(meterRegistry.find("configdrift.comparison.changes").tag("status", "removed").counter()).isNull();
        assertThat(meterRegistry.counter("configdrift.comparison.entities",
                "operation", "network_ssids", "method", "flat", "result", "clean").count()).isEqualTo(1.0);
        assertThat(meterRegistry.find("configdrift.comparison.latency").timer().count()).isEqualTo(2);
    }

    @Test
    void errorsAreTaggedWithCodeAndCategory() {
        metrics.recordError(ErrorCode.SNAPSHOT_STORE_ERROR);

        assertThat(meterRegistry.counter("configdrift.errors", "code", "CD-400", "category", "FATAL").count())
                .isEqualTo(1.0);
    }

    @Test
    void operationContextIsClearedTogether() {
        LoggingConfig.setOperationContext("device_level", "switchport_on_switch");
        assertThat(MDC.get(LoggingConfig.MDC_SCOPE)).isEqualTo("device_level");

        LoggingConfig.clearOperationContext();

        assertThat(MDC.get(LoggingConfig.MDC_SCOPE)).isNull();
        assertThat(MDC.get(LoggingConfig.MDC_OPERATION)).isNull();
    }
}
