package com.delta.listingimport.ingest.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

public enum ParseStatus {
    PENDING,
    QUICK_PARSING,
    QUICK_PARSED,
    FULL_PARSING,
    PARSED,
    IMPORTED,
    FAILED;

    private static final Map<ParseStatus, Set<ParseStatus>> TRANSITIONS = new EnumMap<>(ParseStatus.class);

    static {
        TRANSITIONS.put(PENDING, EnumSet.of(QUICK_PARSING, FULL_PARSING, FAILED));
        TRANSITIONS.put(QUICK_PARSING, EnumSet.of(QUICK_PARSED, FAILED));
        TRANSITIONS.put(QUICK_PARSED, EnumSet.of(FULL_PARSING, FAILED));
        TRANSITIONS.put(FULL_PARSING, EnumSet.of(PARSED, FAILED));
        TRANSITIONS.put(PARSED, EnumSet.of(IMPORTED, FAILED));
        TRANSITIONS.put(IMPORTED, EnumSet.noneOf(ParseStatus.class));
        TRANSITIONS.put(FAILED, EnumSet.noneOf(ParseStatus.class));
    }

    public boolean canTransitionTo(ParseStatus next) {
        return next != null && TRANSITIONS.get(this).contains(next);
    }

    public Set<ParseStatus> allowedNext() {
        return Collections.unmodifiableSet(TRANSITIONS.get(this));
    }

    public boolean isTerminal() {
        return TRANSITIONS.get(this).isEmpty();
    }

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ParseStatus fromCode(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        return ParseStatus.valueOf(value.trim().toUpperCase(Locale.ROOT));
    }
}
