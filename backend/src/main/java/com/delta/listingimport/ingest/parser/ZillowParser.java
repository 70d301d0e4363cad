package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.config.IngestProperties;
import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.model.ListingImage;
import com.delta.listingimport.ingest.model.ListingInfo;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.Pricing;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.model.PropertyDetails;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.render.PageRenderer;
import com.delta.listingimport.ingest.render.StealthProfile;
import com.delta.listingimport.ingest.util.UrlPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

import static com.delta.listingimport.ingest.util.JsonNodes.firstNonBlank;
import static com.delta.listingimport.ingest.util.JsonNodes.integer;
import static com.delta.listingimport.ingest.util.JsonNodes.number;
import static com.delta.listingimport.ingest.util.JsonNodes.path;
import static com.delta.listingimport.ingest.util.JsonNodes.text;

/**
 * zillow.com/homedetails pages. Property data lives in __NEXT_DATA__ under props.pageProps.gdpClientCache,
 * which Zillow ships either as an object or as a JSON-encoded string.
 */
@Component
public class ZillowParser extends AbstractListingParser {
    private static final List<String> CACHE_KEY_MARKERS = List.of("ForSale", "Property", "VariantQuery");

    public ZillowParser(
        PageRenderer renderer,
        StealthProfile stealthProfile,
        IngestProperties properties,
        ObjectMapper objectMapper,
        Clock clock
    ) {
        super(renderer, stealthProfile, properties, objectMapper, clock);
    }

    @Override
    public ListingSource source() {
        return ListingSource.ZILLOW;
    }

    @Override
    public String name() {
        return ListingSource.ZILLOW.displayName();
    }

    @Override
    public boolean canHandle(String url) {
        return UrlPaths.hostMatches(url, "zillow.com") && UrlPaths.rawPath(url).contains("/homedetails/");
    }

    @Override
    public double confidence(String url) {
        if (!canHandle(url)) {
            return 0.0;
        }
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() >= 3
            && segments.get(0).equals("homedetails")
            && segments.get(segments.size() - 1).contains("_zpid")) {
            return 1.0;
        }
        return 0.6;
    }

    @Override
    public UrlAddress extractAddressFromUrl(String url) {
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() < 3 || !segments.get(0).equals("homedetails")) {
            throw new ValidationException("Invalid Zillow URL format: " + url);
        }
        String zpid = segments.get(segments.size() - 1).replace("_zpid", "");
        String[] parts = segments.get(1).split("-");
        if (parts.length < 4) {
            throw new ValidationException("Invalid Zillow address slug: " + segments.get(1));
        }
        String zip = parts[parts.length - 1];
        String state = parts[parts.length - 2];
        String city = parts[parts.length - 3];
        String street = String.join(" ", Arrays.copyOfRange(parts, 0, parts.length - 3));
        return new UrlAddress(zpid, PropertyAddress.of(street, city, state, zip));
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
        JsonNode property = findProperty(pageProps);
        if (property == null) {
            return placeholder(url, urlAddress, "Property data not found in gdpClientCache");
        }

        Double price = number(property, "price");
        Double pricePerSqft = number(property.get("resoFacts"), "pricePerSquareFoot");

        JsonNode address = property.get("address");
        PropertyAddress pageAddress = PropertyAddress.of(
            text(address, "streetAddress"),
            text(address, "city"),
            text(address, "state"),
            text(address, "zipcode")
        );
        PropertyAddress resolved = pageAddress.street() == null ? urlAddress.address() : pageAddress;

        Double lotSize = number(property, "lotSize");
        PropertyDetails details = new PropertyDetails(
            integer(property, "bedrooms"),
            number(property, "bathrooms"),
            integer(property, "livingArea"),
            integer(property, "yearBuilt"),
            RealtorJsonMapper.formatLot(lotSize),
            text(property, "homeType")
        );

        JsonNode attribution = property.get("attributionInfo");
        ListingInfo listingInfo = new ListingInfo(
            text(attribution, "mlsId"),
            text(attribution, "agentName"),
            text(attribution, "brokerName"),
            text(property, "homeStatus"),
            null
        );

        Map<String, Object> extra = new LinkedHashMap<>();
        String description = text(property, "description");
        if (description != null) {
            extra.put("description", description);
        }
        Double zestimate = number(property, "zestimate");
        if (zestimate != null) {
            extra.put("zestimate", zestimate);
        }

        return new ParsedProperty(
            ListingSource.ZILLOW,
            firstNonBlank(text(property, "zpid"), urlAddress.sourceId()),
            resolved,
            Pricing.ofNumeric(price, pricePerSqft),
            photos(property),
            details,
            listingInfo,
            extra,
            null,
            url,
            now()
        );
    }

    private JsonNode findProperty(JsonNode pageProps) {
        JsonNode cache = readCache(pageProps.get("gdpClientCache"));
        if (cache != null) {
            Iterator<Map.Entry<String, JsonNode>> fields = cache.fields();
            while (fields.hasNext()) {
                Map.Entry<String, JsonNode> entry = fields.next();
                boolean keyMatches = CACHE_KEY_MARKERS.stream().anyMatch(marker -> entry.getKey().contains(marker));
                JsonNode property = entry.getValue().get("property");
                if (keyMatches && property != null && property.isObject()) {
                    return property;
                }
            }
        }
        JsonNode componentCache = readCache(path(pageProps, "componentProps.gdpClientCache"));
        if (componentCache != null) {
            for (JsonNode value : componentCache) {
                JsonNode property = value.get("property");
                if (property != null && property.isObject()) {
                    return property;
                }
            }
        }
        return null;
    }

    private JsonNode readCache(JsonNode cache) {
        if (cache == null || cache.isNull()) {
            return null;
        }
        if (cache.isTextual()) {
            return readJson(cache.asText()).filter(JsonNode::isObject).orElse(null);
        }
        return cache.isObject() ? cache : null;
    }

    private List<ListingImage> photos(JsonNode property) {
        JsonNode photos = property.get("responsivePhotos");
        if (photos == null || !photos.isArray()) {
            photos = property.get("photos");
        }
        List<ListingImage> images = new ArrayList<>();
        if (photos == null || !photos.isArray()) {
            return images;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode photo : photos) {
            String imageUrl = largestSource(path(photo, "mixedSources.webp"));
            if (imageUrl == null) {
                imageUrl = largestSource(path(photo, "mixedSources.jpeg"));
            }
            if (imageUrl == null) {
                imageUrl = text(photo, "url");
            }
            if (imageUrl != null && seen.add(imageUrl)) {
                images.add(new ListingImage(imageUrl, text(photo, "caption"), integer(photo, "width"), integer(photo, "height")));
            }
        }
        return images;
    }

    private String largestSource(JsonNode sources) {
        if (sources == null || !sources.isArray() || sources.isEmpty()) {
            return null;
        }
        return text(sources.get(sources.size() - 1), "url");
    }
}
