package com.delta.listingimport.ingest.persistence;

import com.delta.listingimport.ingest.model.ParsedProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * JSON column codec for {@link ParsedProperty} snapshots.
 */
@Component
public class ParsedPropertyJson {
    private static final Logger log = LoggerFactory.getLogger(ParsedPropertyJson.class);

    private final ObjectMapper objectMapper;

    public ParsedPropertyJson(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public String write(ParsedProperty property) {
        if (property == null) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(property);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Unable to serialize parsed property for " + property.sourceUrl(), e);
        }
    }

    public ParsedProperty read(String json) {
        if (json == null || json.isBlank()) {
            return null;
        }
        try {
            return objectMapper.readValue(json, ParsedProperty.class);
        } catch (JsonProcessingException e) {
            log.warn("Stored parsed property could not be read: {}", e.getOriginalMessage());
            return null;
        }
    }
}
