package com.platform.configdrift.connectors.meraki;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Meraki Dashboard API settings bound from {@code configdrift.meraki}.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "configdrift.meraki")
public class MerakiProperties {

    private String baseUrl = "https://api.meraki.com/api/v1";

    /**
     * Dashboard API key, sent as X-Cisco-Meraki-API-Key.
     */
    private String apiKey;

    /**
     * Organization used when a request does not name one.
     */
    private String organizationId;

    /**
     * Page size for paginated list endpoints.
     */
    private int perPage = 1000;

    private int connectTimeoutMs = 5000;

    private int readTimeoutMs = 30000;
}
