package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.platform.configdrift.error.FetchFailureException;
import io.github.resilience4j.circuitbreaker.CallNotPermittedException;
import io.github.resilience4j.circuitbreaker.annotation.CircuitBreaker;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.net.URI;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read-only client for the Meraki Dashboard API.
 * Failures surface as FetchFailureException; transient ones are retried and tracked by the "meraki" circuit breaker.
 */
@Slf4j
@Component
public class MerakiDashboardClient {

    public static final String API_KEY_HEADER = "X-Cisco-Meraki-API-Key";

    private static final Pattern NEXT_LINK = Pattern.compile("<([^>]+)>\\s*;\\s*rel=\"?next\"?");

    private final RestTemplate restTemplate;
    private final MerakiProperties properties;

    public MerakiDashboardClient(RestTemplate restTemplate, MerakiProperties properties) {
        this.restTemplate = restTemplate;
        this.properties = properties;
    }

    /**
     * GET a single resource.
     *
     * @param resource short description used in errors and logs
     */
    @Retry(name = "meraki")
    @CircuitBreaker(name = "meraki", fallbackMethod = "circuitOpenFallback")
    public JsonNode get(String resource, String uriTemplate, Object... uriVariables) {
        log.debug("Fetching {}", resource);
        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(uriTemplate, HttpMethod.GET, null, JsonNode.class, uriVariables);
            return response.getBody();
        } catch (RestClientException e) {
            throw toFetchFailure(resource, e);
        }
    }

    /**
     * GET every page of a list endpoint, following {@code Link: <...>; rel=next} headers.
     */
    @Retry(name = "meraki")
    @CircuitBreaker(name = "meraki", fallbackMethod = "circuitOpenPagesFallback")
    public ArrayNode getAllPages(String resource, String uriTemplate, Object... uriVariables) {
        ArrayNode items = JsonNodeFactory.instance.arrayNode();
        String firstPage = uriTemplate + (uriTemplate.contains("?") ? "&" : "?") + "perPage=" + properties.getPerPage();

        try {
            ResponseEntity<JsonNode> response = restTemplate.exchange(firstPage, HttpMethod.GET, null, JsonNode.class, uriVariables);
            int pages = 1;
            addPage(items, response.getBody(), resource);

            URI next = nextPage(response.getHeaders());
            while (next != null) {
                response = restTemplate.exchange(next, HttpMethod.GET, null, JsonNode.class);
                addPage(items, response.getBody(), resource);
                pages++;
                next = nextPage(response.getHeaders());
            }

            log.debug("Fetched {} {} in {} pages", items.size(), resource, pages);
            return items;
        } catch (RestClientException e) {
            throw toFetchFailure(resource, e);
        }
    }

    private void addPage(ArrayNode items, JsonNode page, String resource) {
        if (page == null || page.isNull()) {
            return;
        }
        if (!page.isArray()) {
            throw new FetchFailureException("meraki", resource, "Expected a list response for " + resource + ", got " + page.getNodeType());
        }
        items.addAll((ArrayNode) page);
    }

    static URI nextPage(HttpHeaders headers) {
        List<String> links = headers.get(HttpHeaders.LINK);
        if (links == null) {
            return null;
        }
        for (String link : links) {
            Matcher matcher = NEXT_LINK.matcher(link);
            if (matcher.find()) {
                return URI.create(matcher.group(1));
            }
        }
        return null;
    }

    private FetchFailureException toFetchFailure(String resource, RestClientException e) {
        if (e instanceof ResourceAccessException) {
            return FetchFailureException.unavailable(resource, e);
        }
        if (e instanceof HttpStatusCodeException) {
            HttpStatusCodeException statusException = (HttpStatusCodeException) e;
            if (statusException.getStatusCode().is5xxServerError()
                    || statusException.getStatusCode().value() == HttpStatus.TOO_MANY_REQUESTS.value()) {
                return FetchFailureException.unavailable(resource, e);
            }
        }
        return FetchFailureException.meraki(resource, e);
    }

    @SuppressWarnings("unused")
    private JsonNode circuitOpenFallback(String resource, String uriTemplate, Object[] uriVariables, CallNotPermittedException e) {
        log.warn("Meraki circuit breaker open, not fetching {}", resource);
        throw FetchFailureException.unavailable(resource, e);
    }

    @SuppressWarnings("unused")
    private ArrayNode circuitOpenPagesFallback(String resource, String uriTemplate, Object[] uriVariables, CallNotPermittedException e) {
        log.warn("Meraki circuit breaker open, not fetching {}", resource);
        throw FetchFailureException.unavailable(resource, e);
    }
}
