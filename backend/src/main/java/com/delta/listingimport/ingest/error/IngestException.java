package com.delta.listingimport.ingest.error;

public abstract class IngestException extends RuntimeException {
    private final String errorCode;

    protected IngestException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    protected IngestException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String errorCode() {
        return errorCode;
    }
}
