package com.delta.listingimport.ingest.render;

import com.delta.listingimport.ingest.model.HttpFetchResult;

import java.time.Duration;

public record RenderedPage(
    String requestedUrl,
    String finalUrl,
    int statusCode,
    String html,
    boolean ready,
    Duration elapsed,
    String errorCode,
    String errorMessage
) {
    public static RenderedPage fromFetch(HttpFetchResult result, boolean ready) {
        return new RenderedPage(
            result.requestedUrl(),
            result.finalUrlOrRequested(),
            result.statusCode(),
            result.body(),
            ready,
            result.duration(),
            result.errorCode(),
            result.errorMessage()
        );
    }

    public boolean isSuccessful() {
        return statusCode >= 200 && statusCode < 300 && errorCode == null;
    }

    public boolean isBlocked() {
        return statusCode == 403 || statusCode == 429 || HttpFetchResult.HOST_BACKOFF.equals(errorCode);
    }

    public boolean isTimeout() {
        return HttpFetchResult.TIMEOUT.equals(errorCode) || statusCode == 408;
    }
}
