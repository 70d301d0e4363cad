package com.delta.listingimport.ingest.http;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.model.HttpFetchResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.net.http.HttpTimeoutException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Semaphore;

/**
 * Single-attempt HTTP transport shared by the page renderer and the listings API client.
 * Caps global concurrency and backs a host off for a while after it answers 403 or 429 to a page fetch.
 */
@Service
public class PoliteHttpClient {
    private static final Logger log = LoggerFactory.getLogger(PoliteHttpClient.class);
    private static final Duration BACKOFF_DURATION = Duration.ofSeconds(30);
    private static final Set<String> RESTRICTED_HEADERS = Set.of("connection", "content-length", "expect", "host", "upgrade");

    private final IngestProperties properties;
    private final HttpClient client;
    private final Semaphore globalLimiter;
    private final Map<String, Object> hostLocks = new ConcurrentHashMap<>();
    private final Map<String, Instant> hostBackoffUntil = new ConcurrentHashMap<>();

    public PoliteHttpClient(
        IngestProperties properties,
        @Qualifier("httpExecutor") ExecutorService httpExecutor
    ) {
        this.properties = properties;
        this.client = HttpClient.newBuilder()
            .followRedirects(HttpClient.Redirect.NORMAL)
            .connectTimeout(Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds()))
            .version(HttpClient.Version.HTTP_1_1)
            .executor(httpExecutor)
            .build();
        this.globalLimiter = new Semaphore(properties.getHttp().getGlobalConcurrency());
    }

    public HttpFetchResult fetchPage(String url, Map<String, String> headers, Duration timeout) {
        return executeOnce(url, "GET", null, headers, timeout, true);
    }

    public HttpFetchResult get(String url, Map<String, String> headers, Duration timeout) {
        return executeOnce(url, "GET", null, headers, timeout, false);
    }

    public HttpFetchResult postJson(String url, String jsonBody, Map<String, String> headers, Duration timeout) {
        return executeOnce(url, "POST", jsonBody == null ? "" : jsonBody, headers, timeout, false);
    }

    public boolean isBackingOff(String host) {
        if (host == null) {
            return false;
        }
        Instant until = hostBackoffUntil.get(host.toLowerCase(Locale.ROOT));
        return until != null && until.isAfter(Instant.now());
    }

    private HttpFetchResult executeOnce(
        String url,
        String method,
        String body,
        Map<String, String> headers,
        Duration timeout,
        boolean pageFetch
    ) {
        Instant startedAt = Instant.now();
        URI uri = normalizeUri(url);
        if (uri == null || uri.getHost() == null) {
            return errorResult(url, startedAt, HttpFetchResult.INVALID_URL, "URL missing host or malformed");
        }
        String host = uri.getHost().toLowerCase(Locale.ROOT);
        if (pageFetch && isBackingOff(host)) {
            return errorResult(url, startedAt, HttpFetchResult.HOST_BACKOFF, "Host is backing off after a block response: " + host);
        }

        boolean acquired = false;
        try {
            globalLimiter.acquire();
            acquired = true;

            Duration effectiveTimeout = timeout == null
                ? Duration.ofSeconds(properties.getHttp().getRequestTimeoutSeconds())
                : timeout;
            HttpRequest.Builder builder = HttpRequest.newBuilder(uri)
                .timeout(effectiveTimeout)
                .header("User-Agent", properties.getHttp().getUserAgent())
                .header("Accept", "*/*");
            if (headers != null) {
                for (Map.Entry<String, String> header : headers.entrySet()) {
                    if (header.getValue() == null || RESTRICTED_HEADERS.contains(header.getKey().toLowerCase(Locale.ROOT))) {
                        continue;
                    }
                    builder.setHeader(header.getKey(), header.getValue());
                }
            }
            HttpRequest request;
            if ("POST".equalsIgnoreCase(method)) {
                request = builder
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(body == null ? "" : body, StandardCharsets.UTF_8))
                    .build();
            } else {
                request = builder.GET().build();
            }

            HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
            if (pageFetch && (response.statusCode() == 403 || response.statusCode() == 429)) {
                extendBackoff(host, BACKOFF_DURATION);
            }
            byte[] responseBytes = response.body();
            String responseBody = responseBytes == null ? null : new String(responseBytes, StandardCharsets.UTF_8);
            log.debug("{} {} -> {} in {}ms", method, url, response.statusCode(),
                Duration.between(startedAt, Instant.now()).toMillis());
            return new HttpFetchResult(
                url,
                response.uri(),
                response.statusCode(),
                responseBody,
                response.headers().firstValue("Content-Type").orElse(null),
                Instant.now(),
                Duration.between(startedAt, Instant.now()),
                null,
                null
            );
        } catch (HttpTimeoutException e) {
            return errorResult(url, startedAt, HttpFetchResult.TIMEOUT, e.getMessage());
        } catch (IOException e) {
            return errorResult(url, startedAt, HttpFetchResult.IO_ERROR, e.getMessage());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return errorResult(url, startedAt, HttpFetchResult.INTERRUPTED, e.getMessage());
        } catch (IllegalArgumentException e) {
            return errorResult(url, startedAt, HttpFetchResult.INVALID_URL, e.getMessage());
        } finally {
            if (acquired) {
                globalLimiter.release();
            }
        }
    }

    private void extendBackoff(String host, Duration duration) {
        Object lock = hostLocks.computeIfAbsent(host, ignored -> new Object());
        synchronized (lock) {
            Instant candidate = Instant.now().plus(duration);
            Instant current = hostBackoffUntil.getOrDefault(host, Instant.now());
            if (candidate.isAfter(current)) {
                hostBackoffUntil.put(host, candidate);
                log.warn("Backing off host {} until {}", host, candidate);
            }
        }
    }

    private HttpFetchResult errorResult(String url, Instant startedAt, String code, String message) {
        return new HttpFetchResult(
            url,
            null,
            0,
            null,
            null,
            Instant.now(),
            Duration.between(startedAt, Instant.now()),
            code,
            message
        );
    }

    private URI normalizeUri(String input) {
        if (input == null || input.isBlank()) {
            return null;
        }
        String value = input.trim();
        if (!value.startsWith("http://") && !value.startsWith("https://")) {
            value = "https://" + value;
        }
        try {
            return new URI(value);
        } catch (URISyntaxException e) {
            return null;
        }
    }
}
