package com.platform.configdrift.store;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Snapshot store settings bound from {@code configdrift.store}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "configdrift.store")
public class SnapshotStoreProperties {

    /**
     * Root directory; scope and operation folders are created below it.
     */
    private String directory = "saved_configs";

    private String timestampPattern = "yyyy-MM-dd_HH-mm-ss";
}
