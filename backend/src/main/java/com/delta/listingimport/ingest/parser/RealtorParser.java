package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.render.PageRenderer;
import com.delta.listingimport.ingest.render.StealthProfile;
import com.delta.listingimport.ingest.util.UrlPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;
import java.util.Optional;

import static com.delta.listingimport.ingest.util.JsonNodes.path;

@Component
public class RealtorParser extends AbstractListingParser {
    private static final String DETAIL_PATH = "/realestateandhomes-detail/";
    private static final String SEARCH_PATH = "/realestateandhomes-search/";
    private static final List<String> PROPERTY_PATHS = List.of(
        "initialReduxState.propertyDetails",
        "initialState.propertyDetails",
        "propertyDetails",
        "property"
    );

    private final RealtorJsonMapper mapper;

    public RealtorParser(
        PageRenderer renderer,
        StealthProfile stealthProfile,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock,
        RealtorJsonMapper mapper
    ) {
        super(renderer, stealthProfile, properties, objectMapper, clock);
        this.mapper = mapper;
    }

    @Override
    public ListingSource source() {
        return ListingSource.REALTOR;
    }

    @Override
    public String name() {
        return ListingSource.REALTOR.displayName();
    }

    @Override
    public boolean canHandle(String url) {
        if (!UrlPaths.hostMatches(url, "realtor.com")) {
            return false;
        }
        String path = UrlPaths.rawPath(url);
        return path.contains(DETAIL_PATH) || path.contains(SEARCH_PATH);
    }

    @Override
    public double confidence(String url) {
        if (!canHandle(url)) {
            return 0.0;
        }
        String path = UrlPaths.rawPath(url);
        if (path.contains(DETAIL_PATH)) {
            return 0.95;
        }
        if (path.contains(SEARCH_PATH)) {
            return 0.5;
        }
        return 0.6;
    }

    /**
     * Slug layout: {@code street-words_City-Words_ST_ZIP_M12345-67890}.
     */
    @Override
    public UrlAddress extractAddressFromUrl(String url) {
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() < 2 || !segments.get(0).equals("realestateandhomes-detail")) {
            throw new ValidationException("Invalid Realtor.com URL format: " + url);
        }
        String[] parts = segments.get(1).split("_");
        if (parts.length < 4) {
            throw new ValidationException("Invalid Realtor.com address slug: " + segments.get(1));
        }
        String street = parts[0].replace('-', ' ');
        String city = parts[1].replace('-', ' ');
        String state = parts[2];
        String zip = parts[3];
        String listingId = parts.length >= 5 ? parts[4] : zip;
        return new UrlAddress(listingId, PropertyAddress.of(street, city, state, zip));
    }

    @Override
    protected ParsedProperty extractFull(Document document, String url, UrlAddress urlAddress) {
        Optional<JsonNode> nextData = readNextData(document);
        if (nextData.isEmpty()) {
            return placeholder(url, urlAddress, "__NEXT_DATA__ script not found");
        }
        JsonNode pageProps = path(nextData.get(), "props.pageProps");
        if (pageProps == null) {
            return placeholder(url, urlAddress, "props.pageProps not found in __NEXT_DATA__");
        }
        JsonNode property = null;
        for (String candidate : PROPERTY_PATHS) {
            JsonNode node = path(pageProps, candidate);
            if (node != null && node.isObject() && (node.has("location") || node.has("list_price"))) {
                property = node;
                break;
            }
        }
        if (property == null) {
            return placeholder(url, urlAddress, "Property data not found in pageProps");
        }
        ParsedProperty parsed = mapper.map(property, ListingSource.REALTOR, urlAddress.sourceId(), url, now());
        if (parsed.address().street() == null) {
            return parsed.withAddress(urlAddress.address());
        }
        return parsed;
    }
}
