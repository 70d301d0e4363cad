package com.delta.listingimport.ingest.render;

import com.delta.listingimport.config.IngestProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Builds render requests that vary user agent and viewport per call so consecutive page loads
 * do not share a fingerprint.
 */
@Component
public class StealthProfile {
    static final List<String> USER_AGENTS = List.of(
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Macintosh; Intel Mac OS X 10_15_7) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36",
        "Mozilla/5.0 (Windows NT 10.0; Win64; x64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/119.0.0.0 Safari/537.36",
        "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 (KHTML, like Gecko) Chrome/120.0.0.0 Safari/537.36"
    );
    static final int BASE_WIDTH = 1920;
    static final int BASE_HEIGHT = 1080;
    static final int VIEWPORT_JITTER = 100;

    private final IngestProperties properties;

    public StealthProfile(IngestProperties properties) {
        this.properties = properties;
    }

    public RenderRequest fullParseRequest(String url) {
        IngestProperties.Parser parser = properties.getParser();
        return new RenderRequest(
            url,
            randomUserAgent(),
            randomViewport(),
            Duration.ofSeconds(parser.getNavigationTimeoutSeconds()),
            Duration.ofSeconds(parser.getReadyTimeoutSeconds()),
            parser.isSimulateHumanBehavior(),
            browserHeaders()
        );
    }

    public RenderRequest quickParseRequest(String url) {
        IngestProperties.Parser parser = properties.getParser();
        return new RenderRequest(
            url,
            randomUserAgent(),
            randomViewport(),
            Duration.ofSeconds(parser.getNavigationTimeoutSeconds()),
            Duration.ofSeconds(parser.getReadyTimeoutSeconds()),
            false,
            browserHeaders()
        );
    }

    public String randomUserAgent() {
        return USER_AGENTS.get(ThreadLocalRandom.current().nextInt(USER_AGENTS.size()));
    }

    public Viewport randomViewport() {
        ThreadLocalRandom random = ThreadLocalRandom.current();
        return new Viewport(BASE_WIDTH + random.nextInt(VIEWPORT_JITTER), BASE_HEIGHT + random.nextInt(VIEWPORT_JITTER));
    }

    private Map<String, String> browserHeaders() {
        Map<String, String> headers = new LinkedHashMap<>();
        headers.put("Accept", "text/html,application/xhtml+xml,application/xml;q=0.9,image/webp,*/*;q=0.8");
        headers.put("Accept-Language", "en-US,en;q=0.9");
        headers.put("Cache-Control", "no-cache");
        return headers;
    }
}
