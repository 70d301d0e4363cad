package com.delta.listingimport.ingest.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static final String TIMEOUT = "timeout";
    public static final String HOST_BACKOFF = "host_backoff";
    public static final String INVALID_URL = "invalid_url";
    public static final String INTERRUPTED = "interrupted";
    public static final String IO_ERROR = "io_error";

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isBlocked() {
        return statusCode == 403 || statusCode == 429 || HOST_BACKOFF.equals(errorCode);
    }

    public boolean isTimeout() {
        return TIMEOUT.equals(errorCode) || statusCode == 408;
    }

    public String finalUrlOrRequested() {
        return finalUri != null ? finalUri.toString() : requestedUrl;
    }
}
