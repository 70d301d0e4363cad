package com.delta.listingimport.ingest.render;

import com.delta.listingimport.ingest.http.PoliteHttpClient;
import com.delta.listingimport.ingest.model.HttpFetchResult;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Renderer that loads the server-side HTML without executing scripts. Listing sites embed their data
 * as JSON in the initial document, so this covers extraction; scroll simulation is not applicable.
 */
@Component
public class HttpPageRenderer implements PageRenderer {
    private static final Logger log = LoggerFactory.getLogger(HttpPageRenderer.class);

    private final PoliteHttpClient httpClient;
    private final AtomicBoolean started = new AtomicBoolean(false);

    public HttpPageRenderer(PoliteHttpClient httpClient) {
        this.httpClient = httpClient;
    }

    @PostConstruct
    @Override
    public void start() {
        if (started.compareAndSet(false, true)) {
            log.info("Page renderer started");
        }
    }

    @Override
    public boolean isStarted() {
        return started.get();
    }

    @Override
    public RenderedPage render(RenderRequest request) {
        if (!started.get()) {
            throw new IllegalStateException("Page renderer is not started");
        }
        Map<String, String> headers = new LinkedHashMap<>(request.headers());
        headers.put("User-Agent", request.userAgent());
        if (request.viewport() != null) {
            headers.put("Viewport-Width", Integer.toString(request.viewport().width()));
        }
        HttpFetchResult result = httpClient.fetchPage(request.url(), headers, request.navigationTimeout());
        boolean ready = result.body() != null && result.body().toLowerCase(Locale.ROOT).contains("<body");
        if (request.simulateHumanBehavior()) {
            log.debug("Scroll simulation skipped for {} (static renderer)", request.url());
        }
        return RenderedPage.fromFetch(result, ready);
    }

    @PreDestroy
    @Override
    public void close() {
        if (started.compareAndSet(true, false)) {
            log.info("Page renderer stopped");
        }
    }
}
