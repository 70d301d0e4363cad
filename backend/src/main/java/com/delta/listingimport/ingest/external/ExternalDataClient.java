package com.delta.listingimport.ingest.external;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.CircuitOpenException;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.parser.RealtorJsonMapper;
import com.delta.listingimport.ingest.util.Sleeper;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static com.delta.listingimport.ingest.util.JsonNodes.firstNumber;
import static com.delta.listingimport.ingest.util.JsonNodes.firstText;
import static com.delta.listingimport.ingest.util.JsonNodes.integer;
import static com.delta.listingimport.ingest.util.JsonNodes.path;
import static com.delta.listingimport.ingest.util.JsonNodes.text;

/**
 * Structured listings API client. Each call passes, outermost first, through request deduplication,
 * the monthly quota, the circuit breaker (with an optional stale-response fallback) and bounded retry
 * before reaching the transport.
 */
@Service
public class ExternalDataClient {
    private static final Logger log = LoggerFactory.getLogger(ExternalDataClient.class);

    static final String SEARCH_PATH = "/properties/v3/list";
    static final String DETAIL_PATH = "/properties/v3/detail";
    static final String SUGGEST_PATH = "/keywords-search-suggest";
    static final int DEFAULT_LIMIT = 10;
    static final int MAX_LIMIT = 200;
    private static final int MIN_SUGGEST_LENGTH = 3;
    private static final Pattern ZIP = Pattern.compile("\\b(\\d{5})\\b");

    private final ListingsApiTransport transport;
    private final ListingsResponseValidator validator;
    private final RealtorJsonMapper mapper;
    private final QuotaManager quotaManager;
    private final IngestProperties properties;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final CircuitBreaker circuitBreaker;
    private final RetryWithBackoff retry;
    private final Endpoint<List<ListingCandidate>> search;
    private final Endpoint<ParsedProperty> detail;
    private final Endpoint<List<AutocompleteSuggestion>> suggest;

    @Autowired
    public ExternalDataClient(
        ListingsApiTransport transport,
        ListingsResponseValidator validator,
        RealtorJsonMapper mapper,
        QuotaManager quotaManager,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        this(transport, validator, mapper, quotaManager, properties, objectMapper, clock, Sleeper.SYSTEM);
    }

    ExternalDataClient(
        ListingsApiTransport transport,
        ListingsResponseValidator validator,
        RealtorJsonMapper mapper,
        QuotaManager quotaManager,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock,
        Sleeper sleeper
    ) {
        this.transport = transport;
        this.validator = validator;
        this.mapper = mapper;
        this.quotaManager = quotaManager;
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.clock = clock;
        IngestProperties.CircuitBreaker breaker = properties.getCircuitBreaker();
        this.circuitBreaker = new CircuitBreaker(
            "listings-api",
            breaker.getFailureThreshold(),
            breaker.getSuccessThreshold(),
            Duration.ofMillis(breaker.getOpenTimeoutMs()),
            clock
        );
        IngestProperties.Retry retryConfig = properties.getRetry();
        this.retry = new RetryWithBackoff(
            retryConfig.getMaxAttempts(),
            retryConfig.getBaseDelayMs(),
            retryConfig.getMaxDelayMs(),
            retryConfig.getJitterRatio(),
            sleeper
        );
        IngestProperties.ExternalApi api = properties.getExternalApi();
        this.search = new Endpoint<>(SEARCH_PATH, api);
        this.detail = new Endpoint<>(DETAIL_PATH, api);
        this.suggest = new Endpoint<>(SUGGEST_PATH, api);
    }

    @PostConstruct
    void logConfiguration() {
        IngestProperties.ExternalApi api = properties.getExternalApi();
        if (!api.hasApiKey()) {
            log.warn("Listings API key is not configured; calls to {} will be rejected upstream", api.getBaseUrl());
        } else {
            log.info("Listings API client ready: {} (quota {} / month, policy {})",
                api.getBaseUrl(), properties.getQuota().getMonthlyLimit(), properties.getQuota().getPolicy());
        }
    }

    public List<ListingCandidate> searchByLocation(String cityOrZip, String stateCode, Integer limit) {
        if (cityOrZip == null || cityOrZip.isBlank()) {
            throw new ValidationException("City or zip code is required");
        }
        String location = cityOrZip.trim();
        Matcher zipMatcher = ZIP.matcher(location);
        String postalCode = zipMatcher.find() ? zipMatcher.group(1) : null;
        String state = stateCode == null || stateCode.isBlank() ? null : stateCode.trim().toUpperCase(Locale.ROOT);
        if (postalCode == null && state == null) {
            throw new ValidationException("State code is required when searching by city");
        }
        int effectiveLimit = limit == null ? DEFAULT_LIMIT : Math.max(1, Math.min(MAX_LIMIT, limit));

        ObjectNode body = objectMapper.createObjectNode();
        body.put("limit", effectiveLimit);
        body.put("offset", 0);
        body.putArray("status").add("for_sale").add("ready_to_build");
        ObjectNode sort = body.putObject("sort");
        sort.put("direction", "desc");
        sort.put("field", "list_date");
        if (postalCode != null) {
            body.put("postal_code", postalCode);
        } else {
            body.put("city", location);
            body.put("state_code", state);
        }

        String key = "search:" + location + ":" + state + ":" + effectiveLimit;
        return call(search, key, () -> {
            List<JsonNode> results = validator.searchResults(transport.post(SEARCH_PATH, body));
            List<ListingCandidate> candidates = new ArrayList<>(results.size());
            for (JsonNode result : results) {
                candidates.add(toCandidate(result));
            }
            log.info("Listings search for {} returned {} candidates", postalCode != null ? postalCode : location + ", " + state,
                candidates.size());
            return List.copyOf(candidates);
        });
    }

    public ParsedProperty getById(String propertyId) {
        if (propertyId == null || propertyId.isBlank()) {
            throw new ValidationException("Property id is required");
        }
        String id = propertyId.trim();
        return call(detail, "property:" + id, () -> {
            JsonNode data = validator.detail(transport.get(DETAIL_PATH, Map.of("property_id", id)));
            return mapper.map(data, ListingSource.EXTERNAL_API, id, externalSourceUrl(id), clock.instant());
        });
    }

    public List<AutocompleteSuggestion> autocomplete(String query) {
        if (query == null || query.trim().length() < MIN_SUGGEST_LENGTH) {
            return List.of();
        }
        String trimmed = query.trim();
        return call(suggest, "suggest:" + trimmed, () -> {
            List<AutocompleteSuggestion> suggestions = new ArrayList<>();
            for (JsonNode item : validator.suggestions(transport.get(SUGGEST_PATH, Map.of("query", trimmed)))) {
                if (item.isTextual()) {
                    suggestions.add(new AutocompleteSuggestion(item.asText(), "address", null));
                    continue;
                }
                String text = firstText(item, "text", "label");
                if (text == null) {
                    continue;
                }
                String type = text(item, "type");
                suggestions.add(new AutocompleteSuggestion(
                    text,
                    type == null ? "address" : type,
                    firstText(item, "mpr_id", "property_id")
                ));
            }
            return List.copyOf(suggestions);
        });
    }

    public ExternalClientHealth health() {
        return new ExternalClientHealth(
            properties.getExternalApi().hasApiKey(),
            circuitBreaker.stats(),
            quotaManager.usage(),
            search.deduplicator.inFlightCount() + detail.deduplicator.inFlightCount()
                + suggest.deduplicator.inFlightCount(),
            search.cachedResponses() + detail.cachedResponses() + suggest.cachedResponses()
        );
    }

    public void resetCircuitBreaker() {
        circuitBreaker.reset();
    }

    public QuotaUsage quotaUsage() {
        return quotaManager.usage();
    }

    public CircuitState circuitState() {
        return circuitBreaker.currentState();
    }

    public static String externalSourceUrl(String propertyId) {
        return "external:" + propertyId;
    }

    private <T> T call(Endpoint<T> endpoint, String key, Supplier<T> upstream) {
        return endpoint.deduplicator.execute(key, () -> admitted(endpoint, key, upstream));
    }

    private <T> T admitted(Endpoint<T> endpoint, String key, Supplier<T> upstream) {
        QuotaTicket ticket = quotaManager.checkAndIncrement(endpoint.path);
        QuotaPolicy policy = quotaManager.policy();
        AtomicBoolean shortCircuited = new AtomicBoolean(false);
        T result;
        try {
            result = circuitBreaker.execute(
                () -> retry.execute(endpoint.path, upstream),
                staleFallback(endpoint, key, shortCircuited)
            );
        } catch (CircuitOpenException e) {
            if (policy != QuotaPolicy.ALL_CALLS) {
                quotaManager.refund(ticket);
            }
            throw e;
        } catch (RuntimeException e) {
            if (policy == QuotaPolicy.SUCCESSFUL_CALLS) {
                quotaManager.refund(ticket);
            }
            throw e;
        }
        if (shortCircuited.get()) {
            if (policy != QuotaPolicy.ALL_CALLS) {
                quotaManager.refund(ticket);
            }
        } else if (endpoint.lastGood != null) {
            endpoint.lastGood.put(key, result);
        }
        return result;
    }

    private <T> Supplier<T> staleFallback(Endpoint<T> endpoint, String key, AtomicBoolean shortCircuited) {
        if (endpoint.lastGood == null) {
            return null;
        }
        return () -> {
            T stale = endpoint.lastGood.getIfPresent(key);
            if (stale == null) {
                throw new CircuitOpenException("Listings API circuit is open and no cached response exists for " + key);
            }
            shortCircuited.set(true);
            log.warn("Listings API circuit is open; serving last good response for {}", key);
            return stale;
        };
    }

    private static ListingCandidate toCandidate(JsonNode result) {
        JsonNode address = path(result, "location.address");
        JsonNode description = result.get("description");
        String photo = text(result.get("primary_photo"), "href");
        if (photo == null) {
            JsonNode photos = result.get("photos");
            if (photos != null && photos.isArray() && photos.size() > 0) {
                photo = text(photos.get(0), "href");
            }
        }
        return new ListingCandidate(
            text(result, "property_id"),
            text(address, "line"),
            text(address, "city"),
            firstText(address, "state_code", "state"),
            text(address, "postal_code"),
            firstNumber(result, "list_price", "price"),
            integer(description, "beds"),
            firstNumber(description, "baths_consolidated", "baths"),
            integer(description, "sqft"),
            photo,
            text(result, "status")
        );
    }

    /** Per-endpoint request collapsing and last-good responses, typed by the endpoint's result. */
    private static final class Endpoint<T> {
        private final String path;
        private final RequestDeduplicator<T> deduplicator = new RequestDeduplicator<>();
        private final Cache<String, T> lastGood;

        private Endpoint(String path, IngestProperties.ExternalApi api) {
            this.path = path;
            this.lastGood = api.isStaleCacheEnabled()
                ? Caffeine.newBuilder()
                    .maximumSize(api.getStaleCacheMaxEntries())
                    .expireAfterWrite(api.getStaleCacheTtlMinutes(), TimeUnit.MINUTES)
                    .build()
                : null;
        }

        private int cachedResponses() {
            if (lastGood == null) {
                return 0;
            }
            lastGood.cleanUp();
            return (int) lastGood.estimatedSize();
        }
    }
}
