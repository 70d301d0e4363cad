package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.TOO_MANY_REQUESTS)
public class BlockedException extends IngestException {
    public BlockedException(String message) {
        super("blocked", message);
    }

    public BlockedException(String message, Throwable cause) {
        super("blocked", message, cause);
    }
}
