package com.delta.listingimport.ingest.model;

import com.fasterxml.jackson.annotation.JsonIgnore;

import java.util.ArrayList;
import java.util.List;

public record PropertyAddress(
    String street,
    String city,
    String state,
    String zip,
    String full
) {
    public static final String PLACEHOLDER = "Parsing property address...";

    public PropertyAddress {
        if (full == null || full.isBlank()) {
            full = format(street, city, state, zip);
        }
    }

    public static PropertyAddress of(String street, String city, String state, String zip) {
        return new PropertyAddress(blankToNull(street), blankToNull(city), blankToNull(state), blankToNull(zip), null);
    }

    public static PropertyAddress placeholder() {
        return new PropertyAddress(null, null, null, null, PLACEHOLDER);
    }

    @JsonIgnore
    public boolean isPlaceholder() {
        return PLACEHOLDER.equals(full);
    }

    /**
     * Formats as "street, City, ST ZIP", skipping missing parts. Falls back to the placeholder text.
     */
    public static String format(String street, String city, String state, String zip) {
        List<String> parts = new ArrayList<>();
        if (street != null && !street.isBlank()) {
            parts.add(street.trim());
        }
        if (city != null && !city.isBlank()) {
            parts.add(city.trim());
        }
        String stateZip = ((state == null ? "" : state.trim()) + " " + (zip == null ? "" : zip.trim())).trim();
        if (!stateZip.isEmpty()) {
            parts.add(stateZip);
        }
        if (parts.isEmpty()) {
            return PLACEHOLDER;
        }
        return String.join(", ", parts);
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
