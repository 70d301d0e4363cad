package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.BAD_GATEWAY)
public class PermanentParseException extends IngestException {
    public PermanentParseException(String message) {
        super("parse_failed", message);
    }

    public PermanentParseException(String message, Throwable cause) {
        super("parse_failed", message, cause);
    }
}
