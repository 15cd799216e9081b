package com.platform.configdrift.observability;

import ch.qos.logback.classic.LoggerContext;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.filter.OncePerRequestFilter;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import java.io.IOException;
import java.util.UUID;

/**
 * Logging configuration: correlation ids per request and MDC helpers for drift runs.
 */
@Slf4j
@Configuration
public class LoggingConfig {

    public static final String MDC_SCOPE = "scope";
    public static final String MDC_OPERATION = "operation";
    public static final String MDC_ENTITY = "entity";

    @Value("${spring.application.name:config-drift-monitor}")
    private String applicationName;

    @PostConstruct
    public void init() {
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        context.putProperty("application", applicationName);

        log.info("Logging configuration initialized for application: {}", applicationName);
    }

    @Bean
    public CorrelationIdFilter correlationIdFilter() {
        return new CorrelationIdFilter();
    }

    /**
     * Copies or generates X-Correlation-ID and exposes it to the log pattern.
     */
    public static class CorrelationIdFilter extends OncePerRequestFilter {

        static final String CORRELATION_ID_HEADER = "X-Correlation-ID";
        private static final String MDC_CORRELATION_ID = "correlationId";

        @Override
        protected void doFilterInternal(
                HttpServletRequest request,
                HttpServletResponse response,
                FilterChain filterChain) throws ServletException, IOException {

            try {
                String correlationId = request.getHeader(CORRELATION_ID_HEADER);
                if (correlationId == null || correlationId.isBlank()) {
                    correlationId = UUID.randomUUID().toString();
                }

                MDC.put(MDC_CORRELATION_ID, correlationId);
                response.setHeader(CORRELATION_ID_HEADER, correlationId);

                filterChain.doFilter(request, response);
            } finally {
                MDC.remove(MDC_CORRELATION_ID);
            }
        }
    }

    /**
     * Set scope and operation in MDC for the duration of a store or compare run.
     */
    public static void setOperationContext(String scope, String operation) {
        MDC.put(MDC_SCOPE, scope);
        MDC.put(MDC_OPERATION, operation);
    }

    public static void clearOperationContext() {
        MDC.remove(MDC_SCOPE);
        MDC.remove(MDC_OPERATION);
    }

    public static void setEntityContext(String entityName) {
        MDC.put(MDC_ENTITY, entityName);
    }

    public static void clearEntityContext() {
        MDC.remove(MDC_ENTITY);
    }
}
