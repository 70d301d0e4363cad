package com.delta.listingimport.ingest.external;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.ResponseValidationException;
import com.delta.listingimport.ingest.error.TransientNetworkException;
import com.delta.listingimport.ingest.error.UpstreamApiException;
import com.delta.listingimport.ingest.http.PoliteHttpClient;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import okhttp3.mockwebserver.RecordedRequest;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpListingsApiTransportTest {
    private final ObjectMapper objectMapper = new ObjectMapper();
    private MockWebServer server;
    private ExecutorService executor;
    private HttpListingsApiTransport transport;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        IngestProperties properties = new IngestProperties();
        properties.getExternalApi().setBaseUrl(server.url("/").toString());
        properties.getExternalApi().setApiKey("secret-key");
        properties.getExternalApi().setHost("listings.example");
        properties.getExternalApi().setTimeoutSeconds(5);
        executor = Executors.newFixedThreadPool(1);
        transport = new HttpListingsApiTransport(new PoliteHttpClient(properties, executor), properties, objectMapper);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void getSendsAuthHeadersAndEncodedQuery() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":{\"property_id\":\"42\"}}"));

        JsonNode response = transport.get("/properties/v3/detail", Map.of("property_id", "42 A"));

        assertThat(response.path("data").path("property_id").asText()).isEqualTo("42");
        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getPath()).isEqualTo("/properties/v3/detail?property_id=42+A");
        assertThat(request.getHeader("X-RapidAPI-Key")).isEqualTo("secret-key");
        assertThat(request.getHeader("X-RapidAPI-Host")).isEqualTo("listings.example");
        assertThat(request.getHeader("Accept")).isEqualTo("application/json");
    }

    @Test
    void postSerializesBody() throws Exception {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("{\"data\":{}}"));

        transport.post("/properties/v3/list", objectMapper.readTree("{\"limit\":5,\"postal_code\":\"85001\"}"));

        RecordedRequest request = server.takeRequest(1, TimeUnit.SECONDS);
        assertThat(request.getMethod()).isEqualTo("POST");
        assertThat(objectMapper.readTree(request.getBody().readUtf8()).path("postal_code").asText()).isEqualTo("85001");
    }

    @Test
    void mapsRetryableStatusesToTransientErrors() {
        server.enqueue(new MockResponse().setResponseCode(503));

        assertThatThrownBy(() -> transport.get("/properties/v3/detail", Map.of("property_id", "1")))
            .isInstanceOfSatisfying(TransientNetworkException.class, e -> assertThat(e.statusCode()).isEqualTo(503));
    }

    @Test
    void mapsClientErrorsToUpstreamErrors() {
        server.enqueue(new MockResponse().setResponseCode(404).setBody("{\"message\":\"missing\"}"));

        assertThatThrownBy(() -> transport.get("/properties/v3/detail", Map.of("property_id", "1")))
            .isInstanceOfSatisfying(UpstreamApiException.class, e -> assertThat(e.statusCode()).isEqualTo(404));
    }

    @Test
    void rejectsEmptyAndNonJsonBodies() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(""));
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html>maintenance</html>"));

        assertThatThrownBy(() -> transport.get("/keywords-search-suggest", Map.of("query", "aus")))
            .isInstanceOf(ResponseValidationException.class)
            .hasMessageContaining("empty body");
        assertThatThrownBy(() -> transport.get("/keywords-search-suggest", Map.of("query", "aus")))
            .isInstanceOf(ResponseValidationException.class)
            .hasMessageContaining("not JSON");
    }
}
