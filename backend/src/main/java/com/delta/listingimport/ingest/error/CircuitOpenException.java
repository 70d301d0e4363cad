package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class CircuitOpenException extends IngestException {
    public CircuitOpenException(String message) {
        super("circuit_open", message);
    }

    public CircuitOpenException(String message, Throwable cause) {
        super("circuit_open", message, cause);
    }
}
