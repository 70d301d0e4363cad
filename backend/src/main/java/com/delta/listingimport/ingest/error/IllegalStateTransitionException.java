package com.delta.listingimport.ingest.error;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class IllegalStateTransitionException extends IngestException {
    public IllegalStateTransitionException(String message) {
        super("illegal_state_transition", message);
    }

    public IllegalStateTransitionException(String message, Throwable cause) {
        super("illegal_state_transition", message, cause);
    }
}
