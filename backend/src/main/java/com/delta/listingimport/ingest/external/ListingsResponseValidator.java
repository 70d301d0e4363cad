package com.delta.listingimport.ingest.external;

import com.delta.listingimport.ingest.error.ResponseValidationException;
import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

import static com.delta.listingimport.ingest.util.JsonNodes.has;
import static com.delta.listingimport.ingest.util.JsonNodes.path;

/**
 * Structural checks on listings API payloads. A search with no {@code home_search} block is an empty
 * result, not an error; anything that breaks the documented minimum raises {@link ResponseValidationException}.
 */
@Component
public class ListingsResponseValidator {
    private static final Logger log = LoggerFactory.getLogger(ListingsResponseValidator.class);

    /**
     * Returns the search result nodes, or an empty list when the response carries no results.
     */
    public List<JsonNode> searchResults(JsonNode response) {
        if (response == null || response.isNull()) {
            throw new ResponseValidationException("Empty response from listings API");
        }
        JsonNode data = path(response, "data");
        if (data == null || !data.isObject()) {
            throw new ResponseValidationException("Invalid search response structure: data");
        }
        JsonNode homeSearch = path(data, "home_search");
        if (homeSearch == null) {
            log.warn("Search response has no home_search block; treating as no results");
            return List.of();
        }
        JsonNode results = homeSearch.get("results");
        if (results == null || results.isNull()) {
            return List.of();
        }
        if (!results.isArray()) {
            throw new ResponseValidationException("Invalid search response structure: data.home_search.results (not an array)");
        }
        List<JsonNode> nodes = new ArrayList<>(results.size());
        results.forEach(nodes::add);
        return nodes;
    }

    /**
     * Returns the property document of a detail response after checking its required fields.
     */
    public JsonNode detail(JsonNode response) {
        if (response == null || response.isNull()) {
            throw new ResponseValidationException("Empty response from listings API");
        }
        JsonNode data = path(response, "data");
        List<String> invalid = new ArrayList<>();
        if (data == null || !data.isObject()) {
            invalid.add("data");
        } else {
            if (path(data, "location.address") == null) {
                invalid.add("location.address");
            }
            if (!has(data, "description") && !has(data, "list_price")) {
                invalid.add("description or list_price");
            }
        }
        if (!invalid.isEmpty()) {
            throw new ResponseValidationException("Invalid property detail response: " + String.join(", ", invalid));
        }
        return data;
    }

    /**
     * Autocomplete payloads are loosely shaped. A missing {@code data} block yields no suggestions.
     */
    public List<JsonNode> suggestions(JsonNode response) {
        JsonNode data = response == null ? null : path(response, "data");
        if (data == null) {
            return List.of();
        }
        if (!data.isArray()) {
            throw new ResponseValidationException("Invalid autocomplete response: data (not an array)");
        }
        List<JsonNode> nodes = new ArrayList<>(data.size());
        data.forEach(nodes::add);
        return nodes;
    }
}
