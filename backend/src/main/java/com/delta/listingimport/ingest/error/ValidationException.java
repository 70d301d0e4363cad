package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class ValidationException extends IngestException {
    public ValidationException(String message) {
        super("validation_error", message);
    }

    public ValidationException(String message, Throwable cause) {
        super("validation_error", message, cause);
    }
}
