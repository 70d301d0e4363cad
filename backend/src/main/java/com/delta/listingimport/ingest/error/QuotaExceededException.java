package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class QuotaExceededException extends IngestException {
    public QuotaExceededException(String message) {
        super("quota_exceeded", message);
    }

    public QuotaExceededException(String message, Throwable cause) {
        super("quota_exceeded", message, cause);
    }
}
