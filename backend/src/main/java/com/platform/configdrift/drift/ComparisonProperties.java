package com.platform.configdrift.drift;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Comparison settings bound from {@code configdrift.comparison}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "configdrift.comparison")
public class ComparisonProperties {

    /**
     * Engine used when a request names none.
     */
    private String defaultMethod = ComparisonMethod.STRUCTURAL.getName();

    /**
     * Entities fetched and compared concurrently; 1 runs sequentially.
     */
    private int parallelism = 1;
}
