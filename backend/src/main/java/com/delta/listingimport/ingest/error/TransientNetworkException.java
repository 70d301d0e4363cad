package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Retryable failure: timeouts and HTTP 429/502/503/504 from an upstream dependency.
 */
@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class TransientNetworkException extends IngestException {
    private final int statusCode;

    public TransientNetworkException(String message, int statusCode) {
        super("upstream_unavailable", message);
        this.statusCode = statusCode;
    }

    public TransientNetworkException(String message, Throwable cause) {
        super("upstream_unavailable", message, cause);
        this.statusCode = 0;
    }

    public int statusCode() {
        return statusCode;
    }
}
