package com.delta.listingimport.ingest.external;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.ResponseValidationException;
import com.delta.listingimport.ingest.error.TransientNetworkException;
import com.delta.listingimport.ingest.error.UpstreamApiException;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.http.PoliteHttpClient;
import com.delta.listingimport.ingest.model.HttpFetchResult;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import java.util.StringJoiner;

@Component
public class HttpListingsApiTransport implements ListingsApiTransport {
    private static final Logger log = LoggerFactory.getLogger(HttpListingsApiTransport.class);
    private static final Set<Integer> RETRYABLE_STATUS = Set.of(429, 502, 503, 504);

    private final PoliteHttpClient httpClient;
    private final IngestProperties properties;
    private final ObjectMapper objectMapper;

    public HttpListingsApiTransport(PoliteHttpClient httpClient, IngestProperties properties, ObjectMapper objectMapper) {
        this.httpClient = httpClient;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @Override
    public JsonNode get(String path, Map<String, String> query) {
        String url = buildUrl(path, query);
        HttpFetchResult result = httpClient.get(url, headers(), timeout());
        return handle("GET " + path, result);
    }

    @Override
    public JsonNode post(String path, JsonNode body) {
        String url = buildUrl(path, Map.of());
        String json;
        try {
            json = objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new ValidationException("Unable to serialize request body for " + path, e);
        }
        HttpFetchResult result = httpClient.postJson(url, json, headers(), timeout());
        return handle("POST " + path, result);
    }

    private JsonNode handle(String operation, HttpFetchResult result) {
        if (result.errorCode() != null) {
            log.debug("{} transport error {}: {}", operation, result.errorCode(), result.errorMessage());
            if (HttpFetchResult.INVALID_URL.equals(result.errorCode())) {
                throw new UpstreamApiException(operation + " has an invalid URL: " + result.errorMessage(), 0);
            }
            throw new TransientNetworkException(
                operation + " failed: " + result.errorCode() + (result.errorMessage() == null ? "" : " " + result.errorMessage()),
                0
            );
        }
        int status = result.statusCode();
        if (RETRYABLE_STATUS.contains(status)) {
            throw new TransientNetworkException(operation + " returned HTTP " + status, status);
        }
        if (status >= 400) {
            throw new UpstreamApiException(operation + " returned HTTP " + status, status);
        }
        String body = result.body();
        if (body == null || body.isBlank()) {
            throw new ResponseValidationException(operation + " returned an empty body");
        }
        try {
            return objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            throw new ResponseValidationException(operation + " returned a body that is not JSON", e);
        }
    }

    private Map<String, String> headers() {
        IngestProperties.ExternalApi api = properties.getExternalApi();
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "application/json");
        if (api.hasApiKey()) {
            headers.put("X-RapidAPI-Key", api.getApiKey());
        }
        headers.put("X-RapidAPI-Host", api.getHost());
        return headers;
    }

    private Duration timeout() {
        return Duration.ofSeconds(properties.getExternalApi().getTimeoutSeconds());
    }

    private String buildUrl(String path, Map<String, String> query) {
        StringBuilder url = new StringBuilder(properties.getExternalApi().getBaseUrl());
        if (!path.startsWith("/")) {
            url.append('/');
        }
        url.append(path);
        if (query != null && !query.isEmpty()) {
            StringJoiner joiner = new StringJoiner("&", "?", "");
            for (Map.Entry<String, String> entry : query.entrySet()) {
                if (entry.getValue() == null) {
                    continue;
                }
                joiner.add(encode(entry.getKey()) + "=" + encode(entry.getValue()));
            }
            url.append(joiner);
        }
        return url.toString();
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
