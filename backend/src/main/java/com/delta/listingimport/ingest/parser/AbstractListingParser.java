package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.BlockedException;
import com.delta.listingimport.ingest.error.PermanentParseException;
import com.delta.listingimport.ingest.error.TransientNetworkException;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.http.RequestRateGate;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyDetails;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.render.PageRenderer;
import com.delta.listingimport.ingest.render.RenderRequest;
import com.delta.listingimport.ingest.render.RenderedPage;
import com.delta.listingimport.ingest.render.StealthProfile;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Shared fetch pipeline: rate gate, render, block and status handling, then site-specific extraction.
 * Extraction problems never escape as exceptions; they degrade to a URL-derived placeholder with diagnostics.
 */
public abstract class AbstractListingParser implements ListingParser {
    private static final Logger log = LoggerFactory.getLogger(AbstractListingParser.class);

    protected final ObjectMapper objectMapper;
    protected final Clock clock;
    private final PageRenderer renderer;
    private final StealthProfile stealthProfile;
    private final RequestRateGate rateGate;

    protected AbstractListingParser(
        PageRenderer renderer,
        StealthProfile stealthProfile,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this(renderer, stealthProfile, new RequestRateGate(properties.getParser().getMinRequestDelayMs()), objectMapper, clock);
    }

    protected AbstractListingParser(
        PageRenderer renderer,
        StealthProfile stealthProfile,
        RequestRateGate rateGate,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this.renderer = renderer;
        this.stealthProfile = stealthProfile;
        this.rateGate = rateGate;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public ParsedProperty quickParse(String url) {
        requireHandled(url);
        Document document = load(stealthProfile.quickParseRequest(url));
        UrlAddress urlAddress = urlAddressOrPlaceholder(url);
        try {
            return extractQuick(document, url, urlAddress);
        } catch (RuntimeException e) {
            log.warn("{} quick extraction failed for {}: {}", name(), url, e.getMessage());
            return placeholder(url, urlAddress, "Quick extraction failed: " + e.getMessage());
        }
    }

    @Override
    public ParsedProperty parse(String url) {
        requireHandled(url);
        Document document = load(stealthProfile.fullParseRequest(url));
        UrlAddress urlAddress = urlAddressOrPlaceholder(url);
        try {
            ParsedProperty parsed = extractFull(document, url, urlAddress);
            if (parsed.hasDiagnostics()) {
                log.warn("{} returned degraded data for {}: {}", name(), url, parsed.diagnostics());
            }
            return parsed;
        } catch (RuntimeException e) {
            log.warn("{} extraction failed for {}: {}", name(), url, e.getMessage());
            return placeholder(url, urlAddress, "Extraction failed: " + e.getMessage());
        }
    }

    protected abstract ParsedProperty extractFull(Document document, String url, UrlAddress urlAddress);

    /**
     * Default quick extraction: the full extraction cut down to address, price, first image and room counts.
     */
    protected ParsedProperty extractQuick(Document document, String url, UrlAddress urlAddress) {
        ParsedProperty full = extractFull(document, url, urlAddress);
        return new ParsedProperty(
            full.source(),
            full.sourceId(),
            full.address(),
            full.pricing(),
            full.images().isEmpty() ? List.of() : List.of(full.images().get(0)),
            new PropertyDetails(
                full.propertyDetails().beds(),
                full.propertyDetails().baths(),
                full.propertyDetails().sqft(),
                null,
                null,
                null
            ),
            null,
            null,
            full.diagnostics(),
            full.sourceUrl(),
            full.extractedAt()
        );
    }

    protected Document load(RenderRequest request) {
        try {
            long waited = rateGate.acquire();
            if (waited > 0) {
                log.debug("{} rate gate held request for {}ms", name(), waited);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientNetworkException("Interrupted while waiting for " + name() + " rate limit", e);
        }
        RenderedPage page = renderer.render(request);
        if (page.isBlocked()) {
            log.warn("{} blocked request for {} (status {})", name(), request.url(), page.statusCode());
            throw new BlockedException(name() + " blocked the request (HTTP " + page.statusCode() + ")");
        }
        if (page.isTimeout()) {
            throw new TransientNetworkException("Timed out loading " + request.url(), 408);
        }
        if (page.errorCode() != null) {
            throw new TransientNetworkException(
                "Failed to load " + request.url() + ": " + page.errorCode() + " " + page.errorMessage(),
                0
            );
        }
        if (page.statusCode() >= 500) {
            throw new TransientNetworkException("HTTP " + page.statusCode() + " loading " + request.url(), page.statusCode());
        }
        if (page.statusCode() >= 400) {
            throw new PermanentParseException("HTTP " + page.statusCode() + " loading " + request.url());
        }
        String html = page.html() == null ? "" : page.html();
        return Jsoup.parse(html, page.finalUrl() == null ? request.url() : page.finalUrl());
    }

    protected Optional<JsonNode> readNextData(Document document) {
        Element script = document.selectFirst("script#__NEXT_DATA__");
        if (script == null) {
            return Optional.empty();
        }
        String json = script.data();
        if (json == null || json.isBlank()) {
            return Optional.empty();
        }
        return readJson(json);
    }

    protected Optional<JsonNode> readJson(String json) {
        try {
            return Optional.ofNullable(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.debug("{} could not read embedded JSON: {}", name(), e.getOriginalMessage());
            return Optional.empty();
        }
    }

    protected UrlAddress urlAddressOrPlaceholder(String url) {
        try {
            return extractAddressFromUrl(url);
        } catch (ValidationException e) {
            return new UrlAddress(null, null);
        }
    }

    protected ParsedProperty placeholder(String url, UrlAddress urlAddress, String... diagnostics) {
        return ParsedProperty.placeholder(source(), urlAddress, url, now(), List.of(diagnostics));
    }

    protected Instant now() {
        return clock.instant();
    }

    protected void requireHandled(String url) {
        if (!canHandle(url)) {
            throw new ValidationException(name() + " cannot handle URL: " + url);
        }
    }
}
