package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.UrlAddress;

/**
 * Extraction contract implemented once per listing site.
 */
public interface ListingParser {

    ListingSource source();

    String name();

    boolean canHandle(String url);

    /**
     * How specifically this parser recognises the URL, in [0, 1]. Zero when {@link #canHandle} is false.
     */
    double confidence(String url);

    /**
     * Derives the listing id and address from the URL alone. Pure: no network access.
     *
     * @throws com.delta.listingimport.ingest.error.ValidationException when the URL does not carry an address
     */
    UrlAddress extractAddressFromUrl(String url);

    /**
     * Loads the page once and extracts a small field subset.
     */
    ParsedProperty quickParse(String url);

    /**
     * Loads the page with a varied fingerprint and extracts every field the site exposes.
     */
    ParsedProperty parse(String url);
}
