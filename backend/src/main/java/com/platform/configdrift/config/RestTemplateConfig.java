package com.platform.configdrift.config;

import com.platform.configdrift.connectors.meraki.MerakiDashboardClient;
import com.platform.configdrift.connectors.meraki.MerakiProperties;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.HttpHeaders;
import org.springframework.http.MediaType;
import org.springframework.web.client.RestTemplate;

import java.time.Duration;

/**
 * REST client for the Meraki Dashboard API.
 */
@Slf4j
@Configuration
public class RestTemplateConfig {

    @Bean
    public RestTemplate merakiRestTemplate(RestTemplateBuilder builder, MerakiProperties properties) {
        String apiKey = properties.getApiKey();
        if (apiKey == null || apiKey.isBlank()) {
            log.warn("No Meraki API key configured (configdrift.meraki.api-key), dashboard calls will be rejected");
            apiKey = "";
        }
        return builder
            .rootUri(properties.getBaseUrl())
            .defaultHeader(MerakiDashboardClient.API_KEY_HEADER, apiKey)
            .defaultHeader(HttpHeaders.ACCEPT, MediaType.APPLICATION_JSON_VALUE)
            .setConnectTimeout(Duration.ofMillis(properties.getConnectTimeoutMs()))
            .setReadTimeout(Duration.ofMillis(properties.getReadTimeoutMs()))
            .build();
    }
}
