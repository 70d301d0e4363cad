package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class ResponseValidationException extends IngestException {
    public ResponseValidationException(String message) {
        super("invalid_upstream_response", message);
    }

    public ResponseValidationException(String message, Throwable cause) {
        super("invalid_upstream_response", message, cause);
    }
}
