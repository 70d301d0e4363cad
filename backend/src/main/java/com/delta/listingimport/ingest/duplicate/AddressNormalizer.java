package com.delta.listingimport.ingest.duplicate;

import java.util.Locale;

public final class AddressNormalizer {
    private AddressNormalizer() {
    }

    /**
     * Lowercased, punctuation stripped, whitespace collapsed. Returns null for blank input.
     */
    public static String normalize(String address) {
        if (address == null) {
            return null;
        }
        String normalized = address.toLowerCase(Locale.ROOT)
            .replaceAll("[^\\w\\s]", "")
            .replaceAll("\\s+", " ")
            .trim();
        return normalized.isEmpty() ? null : normalized;
    }

    public static String priceRange(Double price) {
        if (price == null || price <= 0) {
            return null;
        }
        if (price < 200_000) {
            return "under_200k";
        }
        if (price < 300_000) {
            return "200k_300k";
        }
        if (price < 500_000) {
            return "300k_500k";
        }
        if (price < 750_000) {
            return "500k_750k";
        }
        if (price < 1_000_000) {
            return "750k_1m";
        }
        return "over_1m";
    }
}
