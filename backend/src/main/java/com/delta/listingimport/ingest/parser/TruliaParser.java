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
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

import static com.delta.listingimport.ingest.util.JsonNodes.firstNonBlank;
import static com.delta.listingimport.ingest.util.JsonNodes.firstNumber;
import static com.delta.listingimport.ingest.util.JsonNodes.firstText;
import static com.delta.listingimport.ingest.util.JsonNodes.integer;
import static com.delta.listingimport.ingest.util.JsonNodes.path;
import static com.delta.listingimport.ingest.util.JsonNodes.text;

/**
 * trulia.com listing pages in either URL layout:
 * {@code /home/{street}-{city}-{st}-{zip}-{id}} or {@code /p/{st}/{city}/{street}-{city}-{st}-{zip}--{id}}.
 */
@Component
public class TruliaParser extends AbstractListingParser {

    public TruliaParser(
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
        return ListingSource.TRULIA;
    }

    @Override
    public String name() {
        return ListingSource.TRULIA.displayName();
    }

    @Override
    public boolean canHandle(String url) {
        if (!UrlPaths.hostMatches(url, "trulia.com")) {
            return false;
        }
        String path = UrlPaths.rawPath(url);
        return path.contains("/p/") || path.contains("/home/");
    }

    @Override
    public double confidence(String url) {
        if (!canHandle(url)) {
            return 0.0;
        }
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() >= 2 && segments.get(0).equals("home")) {
            return 0.95;
        }
        if (segments.size() >= 4 && segments.get(0).equals("p") && segments.get(segments.size() - 1).contains("--")) {
            return 0.95;
        }
        return 0.6;
    }

    @Override
    public UrlAddress extractAddressFromUrl(String url) {
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() < 2) {
            throw new ValidationException("Invalid Trulia URL format: " + url);
        }
        if (segments.get(0).equals("home")) {
            return fromHomeSlug(segments.get(1));
        }
        if (segments.get(0).equals("p")) {
            return fromPSegments(segments);
        }
        throw new ValidationException("Unsupported Trulia URL format: " + url);
    }

    private UrlAddress fromHomeSlug(String slug) {
        String[] parts = slug.split("-");
        if (parts.length < 5) {
            throw new ValidationException("Invalid Trulia home slug: " + slug);
        }
        String propertyId = parts[parts.length - 1];
        String zip = parts[parts.length - 2];
        String state = parts[parts.length - 3].toUpperCase(Locale.ROOT);
        String city = UrlPaths.capitalize(parts[parts.length - 4]);
        String street = UrlPaths.titleCase(Arrays.asList(parts).subList(0, parts.length - 4));
        return new UrlAddress(propertyId, PropertyAddress.of(street, city, state, zip));
    }

    private UrlAddress fromPSegments(List<String> segments) {
        if (segments.size() < 4) {
            throw new ValidationException("Invalid /p/ format Trulia URL");
        }
        String state = segments.get(1);
        String citySlug = segments.get(2);
        String addressPart = segments.get(3);
        int separator = addressPart.indexOf("--");
        String propertyId = separator >= 0 ? addressPart.substring(separator + 2) : "";
        String addressSlug = separator >= 0 ? addressPart.substring(0, separator) : addressPart;

        List<String> words = new ArrayList<>(Arrays.asList(addressSlug.split("-")));
        String zip = null;
        if (!words.isEmpty() && words.get(words.size() - 1).matches("\\d{5}")) {
            zip = words.remove(words.size() - 1);
        }
        if (!words.isEmpty() && words.get(words.size() - 1).equalsIgnoreCase(state)) {
            words.remove(words.size() - 1);
        }
        List<String> cityWords = Arrays.asList(citySlug.split("-"));
        if (endsWithIgnoreCase(words, cityWords)) {
            words = new ArrayList<>(words.subList(0, words.size() - cityWords.size()));
        }
        return new UrlAddress(
            propertyId.isEmpty() ? null : propertyId,
            PropertyAddress.of(UrlPaths.titleCase(words), UrlPaths.titleCase(cityWords), state.toUpperCase(Locale.ROOT), zip)
        );
    }

    private boolean endsWithIgnoreCase(List<String> words, List<String> suffix) {
        if (suffix.isEmpty() || suffix.size() > words.size()) {
            return false;
        }
        int offset = words.size() - suffix.size();
        for (int i = 0; i < suffix.size(); i++) {
            if (!words.get(offset + i).equalsIgnoreCase(suffix.get(i))) {
                return false;
            }
        }
        return true;
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
        JsonNode property = pageProps.get("pdpData");
        if (property == null || !property.isObject()) {
            property = pageProps.get("property");
        }
        if (property == null || !property.isObject()) {
            property = pageProps;
        }

        Double price = firstNumber(property, "price");
        if (price == null) {
            price = firstNumber(property.get("price"), "price");
        }
        Double sqftValue = firstNumber(property, "livingArea", "sqft");
        Integer sqft = sqftValue == null ? null : (int) Math.round(sqftValue);
        Double beds = firstNumber(property, "bedrooms", "beds");
        PropertyDetails details = new PropertyDetails(
            beds == null ? null : (int) Math.round(beds),
            firstNumber(property, "bathrooms", "baths"),
            sqft,
            integer(property, "yearBuilt"),
            RealtorJsonMapper.formatLot(firstNumber(property, "lotSize")),
            firstText(property, "propertyType", "type")
        );

        JsonNode address = property.get("address");
        PropertyAddress pageAddress = PropertyAddress.of(
            firstText(address, "streetAddress", "line"),
            text(address, "city"),
            firstText(address, "state", "stateCode"),
            firstText(address, "zipcode", "postalCode")
        );

        ListingInfo listingInfo = new ListingInfo(
            text(property, "mlsId"),
            firstNonBlank(text(property.get("agent"), "name"), text(property, "listingAgent")),
            firstNonBlank(text(property, "brokerName"), text(property.get("office"), "name")),
            firstText(property, "status", "listingStatus"),
            text(property, "listDate")
        );

        List<ListingImage> images = photos(property);
        List<String> diagnostics = new ArrayList<>();
        if (price == null && images.isEmpty() && pageAddress.street() == null) {
            diagnostics.add("Property data not found in pageProps");
        }
        return new ParsedProperty(
            ListingSource.TRULIA,
            urlAddress.sourceId(),
            pageAddress.street() == null ? urlAddress.address() : pageAddress,
            Pricing.ofNumeric(price, null),
            images,
            details,
            listingInfo,
            null,
            diagnostics,
            url,
            now()
        );
    }

    private List<ListingImage> photos(JsonNode property) {
        JsonNode photos = null;
        for (String field : List.of("photos", "images", "media")) {
            JsonNode candidate = property.get(field);
            if (candidate != null && candidate.isArray()) {
                photos = candidate;
                break;
            }
        }
        List<ListingImage> images = new ArrayList<>();
        if (photos == null) {
            return images;
        }
        Set<String> seen = new LinkedHashSet<>();
        for (JsonNode photo : photos) {
            String imageUrl = firstText(photo, "url", "href", "src");
            if (imageUrl != null && seen.add(imageUrl)) {
                images.add(ListingImage.of(imageUrl, firstText(photo, "caption", "description")));
            }
        }
        return images;
    }
}
