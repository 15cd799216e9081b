package com.platform.configdrift.connectors.meraki;

import com.fasterxml.jackson.databind.JsonNode;
import com.platform.configdrift.config.RestTemplateConfig;
import com.platform.configdrift.error.ErrorCode;
import com.platform.configdrift.error.FetchFailureException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.test.web.client.MockRestServiceServer;
import org.springframework.web.client.RestTemplate;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.header;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.method;
import static org.springframework.test.web.client.match.MockRestRequestMatchers.requestTo;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withResourceNotFound;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withServerError;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withStatus;
import static org.springframework.test.web.client.response.MockRestResponseCreators.withSuccess;

class MerakiDashboardClientTest {

    static final String BASE_URL = "https://api.test/api/v1";

    private MockRestServiceServer server;
    private MerakiDashboardClient client;

    @BeforeEach
    void setUp() {
        MerakiProperties properties = new MerakiProperties();
        properties.setBaseUrl(BASE_URL);
        properties.setApiKey("test-key");
        properties.setPerPage(2);
        RestTemplate restTemplate = new RestTemplateConfig().merakiRestTemplate(new RestTemplateBuilder(), properties);
        server = MockRestServiceServer.bindTo(restTemplate).build();
        client = new MerakiDashboardClient(restTemplate, properties);
    }

    @Test
    void sendsApiKeyAndParsesBody() {
        server.expect(requestTo(BASE_URL + "/organizations/1"))
                .andExpect(method(HttpMethod.GET))
                .andExpect(header(MerakiDashboardClient.API_KEY_HEADER, "test-key"))
                .andRespond(withSuccess("{\"id\": \"1\", \"name\": \"Acme\"}", MediaType.APPLICATION_JSON));

        JsonNode organization = client.get("organization 1", MerakiEndpoints.ORGANIZATION, "1");

        assertThat(organization.get("name").asText()).isEqualTo("Acme");
        server.verify();
    }

    @Test
    void followsNextLinksAcrossPages() {
        String second = BASE_URL + "/organizations/1/networks?perPage=2&startingAfter=N_2";
        HttpHeaders firstHeaders = new HttpHeaders();
        firstHeaders.add(HttpHeaders.LINK, "<" + BASE_URL + "/organizations/1/networks?perPage=2>; rel=first, <"
                + second + ">; rel=next");
        server.expect(requestTo(BASE_URL + "/organizations/1/networks?perPage=2"))
                .andRespond(withSuccess("[{\"id\": \"N_1\"}, {\"id\": \"N_2\"}]", MediaType.APPLICATION_JSON)
                        .headers(firstHeaders));
        server.expect(requestTo(second))
                .andRespond(withSuccess("[{\"id\": \"N_3\"}]", MediaType.APPLICATION_JSON));

        JsonNode networks = client.getAllPages("networks", MerakiEndpoints.ORGANIZATION_NETWORKS, "1");

        assertThat(networks).hasSize(3);
        assertThat(networks.get(2).get("id").asText()).isEqualTo("N_3");
        server.verify();
    }

    @Test
    void clientErrorIsDashboardApiError() {
        server.expect(requestTo(BASE_URL + "/devices/Q2AA/switch/ports")).andRespond(withResourceNotFound());

        assertThatThrownBy(() -> client.get("switch ports", MerakiEndpoints.DEVICE_SWITCH_PORTS, "Q2AA"))
                .isInstanceOf(FetchFailureException.class)
                .extracting(e -> ((FetchFailureException) e).getErrorCode())
                .isEqualTo(ErrorCode.DASHBOARD_API_ERROR);
    }

    @Test
    void serverErrorAndRateLimitAreTransient() {
        server.expect(requestTo(BASE_URL + "/organizations")).andRespond(withServerError());
        server.expect(requestTo(BASE_URL + "/organizations")).andRespond(withStatus(HttpStatus.TOO_MANY_REQUESTS));
        TransientFetchFailure transientFailure = new TransientFetchFailure();

        for (int attempt = 0; attempt < 2; attempt++) {
            assertThatThrownBy(() -> client.get("organizations", MerakiEndpoints.ORGANIZATIONS))
                    .isInstanceOf(FetchFailureException.class)
                    .satisfies(e -> assertThat(transientFailure.test(e)).isTrue());
        }
    }

    @Test
    void nonListPageIsRejected() {
        server.expect(requestTo(BASE_URL + "/organizations/1/devices?perPage=2"))
                .andRespond(withSuccess("{\"errors\": []}", MediaType.APPLICATION_JSON));

        assertThatThrownBy(() -> client.getAllPages("devices", MerakiEndpoints.ORGANIZATION_DEVICES, "1"))
                .isInstanceOf(FetchFailureException.class)
                .hasMessageContaining("Expected a list");
    }

    @Test
    void nextPageIsAbsentWithoutNextLink() {
        HttpHeaders headers = new HttpHeaders();
        headers.add(HttpHeaders.LINK, "<https://api.test/x?page=1>; rel=first");

        assertThat(MerakiDashboardClient.nextPage(headers)).isNull();
        assertThat(MerakiDashboardClient.nextPage(new HttpHeaders())).isNull();
    }
}
