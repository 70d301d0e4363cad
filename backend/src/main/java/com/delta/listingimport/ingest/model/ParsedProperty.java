package com.delta.listingimport.ingest.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public record ParsedProperty(
    ListingSource source,
    String sourceId,
    PropertyAddress address,
    Pricing pricing,
    List<ListingImage> images,
    PropertyDetails propertyDetails,
    ListingInfo listingInfo,
    Map<String, Object> rawExtra,
    List<String> diagnostics,
    String sourceUrl,
    Instant extractedAt
) {
    public ParsedProperty {
        source = source == null ? ListingSource.UNKNOWN : source;
        address = address == null ? PropertyAddress.placeholder() : address;
        pricing = pricing == null ? Pricing.unknown() : pricing;
        images = images == null ? List.of() : List.copyOf(images);
        propertyDetails = propertyDetails == null ? PropertyDetails.empty() : propertyDetails;
        listingInfo = listingInfo == null ? ListingInfo.empty() : listingInfo;
        rawExtra = rawExtra == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(rawExtra));
        diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
    }

    /**
     * Result for a page whose structure could not be read: URL-derived address, empty fields, diagnostics.
     */
    public static ParsedProperty placeholder(
        ListingSource source,
        UrlAddress urlAddress,
        String sourceUrl,
        Instant extractedAt,
        List<String> diagnostics
    ) {
        return new ParsedProperty(
            source,
            urlAddress == null ? null : urlAddress.sourceId(),
            urlAddress == null ? null : urlAddress.address(),
            null,
            null,
            null,
            null,
            null,
            diagnostics,
            sourceUrl,
            extractedAt
        );
    }

    public boolean hasDiagnostics() {
        return !diagnostics.isEmpty();
    }

    public ParsedProperty withAddress(PropertyAddress newAddress) {
        return new ParsedProperty(
            source, sourceId, newAddress, pricing, images, propertyDetails, listingInfo,
            rawExtra, diagnostics, sourceUrl, extractedAt
        );
    }
}
