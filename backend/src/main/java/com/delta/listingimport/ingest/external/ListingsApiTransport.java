package com.delta.listingimport.ingest.external;

import com.fasterxml.jackson.databind.JsonNode;

import java.util.Map;

/**
 * Raw single-attempt access to the structured listings API. Implementations raise
 * {@link com.delta.listingimport.ingest.error.TransientNetworkException} for retryable failures and
 * {@link com.delta.listingimport.ingest.error.UpstreamApiException} for everything else.
 */
public interface ListingsApiTransport {
    JsonNode get(String path, Map<String, String> query);

    JsonNode post(String path, JsonNode body);
}
