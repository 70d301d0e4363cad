package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class NotFoundException extends IngestException {
    public NotFoundException(String message) {
        super("not_found", message);
    }

    public NotFoundException(String message, Throwable cause) {
        super("not_found", message, cause);
    }
}
