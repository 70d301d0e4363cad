package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.ingest.model.ListingImage;
import com.delta.listingimport.ingest.model.ListingInfo;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.Pricing;
import com.delta.listingimport.ingest.model.PropertyAddress;
import com.delta.listingimport.ingest.model.PropertyDetails;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

import static com.delta.listingimport.ingest.util.JsonNodes.firstNonBlank;
import static com.delta.listingimport.ingest.util.JsonNodes.firstNumber;
import static com.delta.listingimport.ingest.util.JsonNodes.firstText;
import static com.delta.listingimport.ingest.util.JsonNodes.integer;
import static com.delta.listingimport.ingest.util.JsonNodes.path;
import static com.delta.listingimport.ingest.util.JsonNodes.text;

/**
 * Maps the realtor.com property document (location/description/photos/advertisers) to a ParsedProperty.
 * The same document shape is served both in realtor.com page data and by the listings API.
 */
@Component
public class RealtorJsonMapper {
    private final ObjectMapper objectMapper;

    public RealtorJsonMapper(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public ParsedProperty map(JsonNode property, ListingSource source, String fallbackId, String sourceUrl, Instant extractedAt) {
        JsonNode address = path(property, "location.address");
        JsonNode description = property.get("description");

        PropertyAddress propertyAddress = PropertyAddress.of(
            text(address, "line"),
            text(address, "city"),
            firstText(address, "state_code", "state"),
            text(address, "postal_code")
        );

        Double price = firstNumber(property, "list_price", "price");
        Integer sqft = integer(description, "sqft");
        Double pricePerSqft = firstNumber(property, "price_per_sqft");
        if (pricePerSqft == null && price != null && sqft != null && sqft > 0) {
            pricePerSqft = (double) Math.round(price / sqft);
        }

        PropertyDetails details = new PropertyDetails(
            integer(description, "beds"),
            firstNumber(description, "baths_consolidated", "baths"),
            sqft,
            integer(description, "year_built"),
            formatLot(firstNumber(description, "lot_sqft")),
            firstText(description, "type", "sub_type")
        );

        JsonNode advertiser = firstElement(property.get("advertisers"));
        ListingInfo listingInfo = new ListingInfo(
            text(property.get("source"), "listing_id"),
            text(advertiser, "name"),
            text(advertiser == null ? null : advertiser.get("office"), "name"),
            text(property, "status"),
            text(property, "list_date")
        );

        String sourceId = firstNonBlank(text(property, "property_id"), text(property, "listing_id"), fallbackId);
        return new ParsedProperty(
            source,
            sourceId,
            propertyAddress,
            Pricing.ofNumeric(price, pricePerSqft),
            photos(property),
            details,
            listingInfo,
            rawExtra(property, description),
            null,
            firstNonBlank(sourceUrl, text(property, "href")),
            extractedAt
        );
    }

    private List<ListingImage> photos(JsonNode property) {
        Set<String> seen = new LinkedHashSet<>();
        List<ListingImage> images = new ArrayList<>();
        JsonNode photos = property.get("photos");
        if (photos != null && photos.isArray()) {
            for (JsonNode photo : photos) {
                String href = photo.isTextual() ? photo.asText() : firstText(photo, "href", "url");
                if (href != null && seen.add(href)) {
                    images.add(ListingImage.of(href, text(photo, "description")));
                }
            }
        }
        if (images.isEmpty()) {
            String primary = text(property.get("primary_photo"), "href");
            if (primary != null) {
                images.add(ListingImage.of(primary, null));
            }
        }
        return images;
    }

    private Map<String, Object> rawExtra(JsonNode property, JsonNode description) {
        Map<String, Object> extra = new LinkedHashMap<>();
        putIfPresent(extra, "description", text(description, "text"));
        putIfPresent(extra, "tax_history", property.get("tax_history"));
        putIfPresent(extra, "nearby_schools", path(property, "nearby_schools.schools"));
        putIfPresent(extra, "flood_risk", text(path(property, "local.flood"), "flood_factor_severity"));
        putIfPresent(extra, "fire_risk", text(path(property, "local.wildfire"), "fire_factor_severity"));
        putIfPresent(extra, "noise_score", path(property, "local.noise.score"));
        putIfPresent(extra, "href", text(property, "href"));
        putIfPresent(extra, "permalink", text(property, "permalink"));
        putIfPresent(extra, "last_sold_price", property.get("last_sold_price"));
        putIfPresent(extra, "last_sold_date", text(property, "last_sold_date"));
        return extra;
    }

    private void putIfPresent(Map<String, Object> target, String key, Object value) {
        if (value == null) {
            return;
        }
        if (value instanceof JsonNode node) {
            if (node.isNull() || node.isMissingNode()) {
                return;
            }
            target.put(key, objectMapper.convertValue(node, Object.class));
            return;
        }
        target.put(key, value);
    }

    private JsonNode firstElement(JsonNode array) {
        if (array == null || !array.isArray() || array.isEmpty()) {
            return null;
        }
        return array.get(0);
    }

    static String formatLot(Double lotSqft) {
        if (lotSqft == null || lotSqft <= 0) {
            return null;
        }
        return String.format(Locale.US, "%,d sqft", Math.round(lotSqft));
    }
}
