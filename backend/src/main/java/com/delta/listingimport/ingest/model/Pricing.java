package com.delta.listingimport.ingest.model;

import java.text.NumberFormat;
import java.util.Locale;

public record Pricing(
    String displayPrice,
    Double numericPrice,
    Double pricePerSqft
) {
    public static Pricing unknown() {
        return new Pricing(null, null, null);
    }

    public static Pricing ofNumeric(Double numericPrice, Double pricePerSqft) {
        if (numericPrice == null) {
            return new Pricing(null, null, pricePerSqft);
        }
        return new Pricing(formatUsd(numericPrice), numericPrice, pricePerSqft);
    }

    public static String formatUsd(double amount) {
        NumberFormat format = NumberFormat.getIntegerInstance(Locale.US);
        return "$" + format.format(Math.round(amount));
    }
}
