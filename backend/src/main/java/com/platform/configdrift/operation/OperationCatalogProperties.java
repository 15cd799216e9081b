package com.platform.configdrift.operation;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.List;

/**
 * Operation catalog bound from {@code configdrift.operations}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "configdrift")
public class OperationCatalogProperties {

    private List<OperationProperties> operations = new ArrayList<>();

    @Data
    public static class OperationProperties {
        private String name;
        private OperationScope scope;
        private String displayName;
        private String folder;
        private String fileName;
        private String groupingKey;
        private String productType;
    }
}
