package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class UpstreamApiException extends IngestException {
    private final int statusCode;

    public UpstreamApiException(String message, int statusCode) {
        super("upstream_error", message);
        this.statusCode = statusCode;
    }

    public int statusCode() {
        return statusCode;
    }
}
