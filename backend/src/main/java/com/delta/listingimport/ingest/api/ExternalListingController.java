package com.delta.listingimport.ingest.api;

import com.delta.listingimport.ingest.external.AutocompleteSuggestion;
import com.delta.listingimport.ingest.external.ExternalClientHealth;
import com.delta.listingimport.ingest.external.ExternalDataClient;
import com.delta.listingimport.ingest.external.ListingCandidate;
import com.delta.listingimport.ingest.external.LocationQuery;
import com.delta.listingimport.ingest.external.LocationQueryParser;
import com.delta.listingimport.ingest.external.QuotaUsage;
import com.delta.listingimport.ingest.model.ParsedProperty;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/listings")
public class ExternalListingController {
    private final ExternalDataClient externalDataClient;
    private final LocationQueryParser locationQueryParser;

    public ExternalListingController(ExternalDataClient externalDataClient, LocationQueryParser locationQueryParser) {
        this.externalDataClient = externalDataClient;
        this.locationQueryParser = locationQueryParser;
    }

    /**
     * Either {@code location} alone ("Louisville, KY", "40202") or {@code location} plus an explicit {@code state}.
     */
    @GetMapping("/search")
    public Map<String, Object> search(
        @RequestParam("location") String location,
        @RequestParam(name = "state", required = false) String state,
        @RequestParam(name = "limit", required = false) Integer limit
    ) {
        List<ListingCandidate> results;
        if (state != null && !state.isBlank()) {
            results = externalDataClient.searchByLocation(location, state, limit);
        } else {
            LocationQuery query = locationQueryParser.parse(location);
            results = externalDataClient.searchByLocation(query.cityOrZip(), query.state(), limit);
        }
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", results.size());
        response.put("results", results);
        return response;
    }

    @GetMapping("/lookup/{id}")
    public ParsedProperty lookup(@PathVariable("id") String propertyId) {
        return externalDataClient.getById(propertyId);
    }

    @GetMapping("/autocomplete")
    public Map<String, Object> autocomplete(@RequestParam(name = "query", required = false) String query) {
        List<AutocompleteSuggestion> suggestions = externalDataClient.autocomplete(query);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("count", suggestions.size());
        response.put("suggestions", suggestions);
        return response;
    }

    @GetMapping("/health")
    public ExternalClientHealth health() {
        return externalDataClient.health();
    }

    @GetMapping("/quota")
    public QuotaUsage quota() {
        return externalDataClient.quotaUsage();
    }

    @PostMapping("/circuit-breaker/reset")
    public ExternalClientHealth resetCircuitBreaker() {
        externalDataClient.resetCircuitBreaker();
        return externalDataClient.health();
    }
}
