package com.delta.listingimport.ingest.render;

import java.time.Duration;
import java.util.Map;

public record RenderRequest(
    String url,
    String userAgent,
    Viewport viewport,
    Duration navigationTimeout,
    Duration readyTimeout,
    boolean simulateHumanBehavior,
    Map<String, String> headers
) {
    public RenderRequest {
        headers = headers == null ? Map.of() : Map.copyOf(headers);
    }
}
