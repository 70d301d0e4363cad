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
import com.delta.listingimport.ingest.util.JsonNodes;
import com.delta.listingimport.ingest.util.UrlPaths;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * flexmls.com/share pages. These are server-rendered; photos come from the hidden
 * #tagged_listing_media JSON and the remaining facts from the page text.
 */
@Component
public class FlexmlsParser extends AbstractListingParser {
    private static final Pattern TRAILING_ZIP = Pattern.compile("\\d{5}(-\\d{4})?$");
    private static final Pattern SRC_ATTR = Pattern.compile("src=\"([^\"]+)\"");
    private static final Pattern ALT_ATTR = Pattern.compile("alt=\"([^\"]+)\"");
    private static final Pattern DIMENSIONS = Pattern.compile("/\\d+x\\d+/");
    private static final Pattern IMAGE_ID = Pattern.compile("/(\\d{26}-[a-z]\\.jpg)", Pattern.CASE_INSENSITIVE);
    private static final Pattern PRICE = Pattern.compile("\\$[\\d,]+");
    private static final Pattern MLS_NUMBER = Pattern.compile("mls\\s*#?\\s*:?\\s*([A-Za-z0-9]*\\d[A-Za-z0-9]*)", Pattern.CASE_INSENSITIVE);
    private static final List<Pattern> BED_PATTERNS = patterns(
        "(\\d+)\\s*bed(?:room)?s?",
        "bed(?:room)?s?\\s*:?\\s*(\\d+)",
        "(\\d+)\\s*bd\\b",
        "(\\d+)\\s*br\\b"
    );
    private static final List<Pattern> BATH_PATTERNS = patterns(
        "(\\d+(?:\\.\\d+)?)\\s*bath(?:room)?s?",
        "bath(?:room)?s?\\s*:?\\s*(\\d+(?:\\.\\d+)?)",
        "(\\d+(?:\\.\\d+)?)\\s*ba\\b"
    );
    private static final List<Pattern> SQFT_PATTERNS = patterns(
        "([\\d,]+)\\s*sq\\.?\\s*ft",
        "([\\d,]+)\\s*square\\s*feet",
        "sq\\.?\\s*ft\\.?\\s*:?\\s*([\\d,]+)",
        "sqft\\s*:?\\s*([\\d,]+)"
    );
    private static final List<String> PRICE_SELECTORS = List.of(
        "[data-testid=listing-price]", ".listing-price", ".price", ".property-price"
    );
    private static final List<String> IGNORED_IMAGE_MARKERS = List.of("logo", "icon", "map", "avatar", "data:image");
    private static final List<String> DESCRIPTION_MARKERS = List.of("bedroom", "kitchen", "living", "home", "property", "house");

    public FlexmlsParser(
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
        return ListingSource.FLEXMLS;
    }

    @Override
    public String name() {
        return ListingSource.FLEXMLS.displayName();
    }

    @Override
    public boolean canHandle(String url) {
        return UrlPaths.hostMatches(url, "flexmls.com") && UrlPaths.rawPath(url).contains("/share/");
    }

    @Override
    public double confidence(String url) {
        if (!canHandle(url)) {
            return 0.0;
        }
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() >= 3 && segments.get(0).equals("share")) {
            return 1.0;
        }
        return 0.5;
    }

    @Override
    public UrlAddress extractAddressFromUrl(String url) {
        List<String> segments = UrlPaths.segments(url);
        if (segments.size() < 3 || !segments.get(0).equals("share")) {
            throw new ValidationException("Invalid FlexMLS URL format: " + url);
        }
        String shareId = segments.get(1);
        String[] parts = segments.get(2).split("-");
        if (parts.length < 4) {
            throw new ValidationException("Invalid FlexMLS property slug: " + segments.get(2));
        }
        String zip = parts[parts.length - 1];
        String state = parts[parts.length - 2];
        String city = TRAILING_ZIP.matcher(parts[parts.length - 3]).replaceAll("").trim();
        List<String> streetWords = new ArrayList<>(Arrays.asList(parts).subList(0, parts.length - 3));
        // Slugs sometimes repeat the city at the end of the street part.
        while (!city.isEmpty() && !streetWords.isEmpty()
            && streetWords.get(streetWords.size() - 1).equalsIgnoreCase(city)) {
            streetWords.remove(streetWords.size() - 1);
        }
        String street = String.join(" ", streetWords);
        return new UrlAddress(shareId, PropertyAddress.of(street, city, state, zip));
    }

    @Override
    protected ParsedProperty extractFull(Document document, String url, UrlAddress urlAddress) {
        String bodyText = document.body() == null ? "" : document.body().text();
        List<ListingImage> images = taggedMediaImages(document);
        if (images.isEmpty()) {
            images = pageImages(document);
        }
        Double price = firstPrice(bodyText);
        Integer beds = toInteger(firstGroup(BED_PATTERNS, bodyText));
        Double baths = JsonNodes.parseNumber(firstGroup(BATH_PATTERNS, bodyText));
        Integer sqft = toInteger(firstGroup(SQFT_PATTERNS, bodyText));
        String mlsNumber = firstGroup(List.of(MLS_NUMBER), bodyText);

        List<String> diagnostics = new ArrayList<>();
        if (images.isEmpty() && price == null && beds == null && sqft == null) {
            diagnostics.add("No listing data found on FlexMLS page");
        }

        Map<String, Object> extra = new LinkedHashMap<>();
        String description = description(document);
        if (description != null) {
            extra.put("description", description);
        }

        return new ParsedProperty(
            ListingSource.FLEXMLS,
            urlAddress.sourceId(),
            urlAddress.address(),
            Pricing.ofNumeric(price, pricePerSqft(price, sqft)),
            images,
            new PropertyDetails(beds, baths, sqft, null, null, null),
            new ListingInfo(mlsNumber, null, null, null, null),
            extra,
            diagnostics,
            url,
            now()
        );
    }

    @Override
    protected ParsedProperty extractQuick(Document document, String url, UrlAddress urlAddress) {
        String bodyText = document.body() == null ? "" : document.body().text();
        List<ListingImage> images = taggedMediaImages(document);
        if (images.isEmpty()) {
            images = pageImages(document);
        }
        Double price = null;
        for (String selector : PRICE_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element != null) {
                Double candidate = JsonNodes.parseNumber(element.text());
                if (candidate != null && candidate > 0) {
                    price = candidate;
                    break;
                }
            }
        }
        if (price == null) {
            price = firstPrice(bodyText);
        }
        Integer beds = toInteger(selectorNumber(document, "[data-testid=beds], .beds, .bed-count, .property-beds"));
        if (beds == null) {
            beds = toInteger(firstGroup(BED_PATTERNS, bodyText));
        }
        String bathText = selectorNumber(document, "[data-testid=baths], .baths, .bath-count, .property-baths");
        Double baths = JsonNodes.parseNumber(bathText == null ? firstGroup(BATH_PATTERNS, bodyText) : bathText);
        Integer sqft = toInteger(selectorNumber(document, "[data-testid=sqft], .sqft, .square-feet, .property-sqft"));
        if (sqft == null) {
            sqft = toInteger(firstGroup(SQFT_PATTERNS, bodyText));
        }
        return new ParsedProperty(
            ListingSource.FLEXMLS,
            urlAddress.sourceId(),
            urlAddress.address(),
            Pricing.ofNumeric(price, null),
            images.isEmpty() ? List.of() : List.of(images.get(0)),
            new PropertyDetails(beds, baths, sqft, null, null, null),
            null,
            null,
            null,
            url,
            now()
        );
    }

    List<ListingImage> taggedMediaImages(Document document) {
        List<ListingImage> images = new ArrayList<>();
        Element media = document.selectFirst("#tagged_listing_media");
        if (media == null) {
            return images;
        }
        String json = media.data().isBlank() ? media.text() : media.data();
        JsonNode all = readJson(json).map(root -> JsonNodes.path(root, "combined.All")).orElse(null);
        if (all == null || !all.isArray()) {
            return images;
        }
        Set<String> seenIds = new LinkedHashSet<>();
        for (JsonNode item : all) {
            String html = JsonNodes.text(item, "html");
            if (html == null) {
                continue;
            }
            Matcher src = SRC_ATTR.matcher(html);
            if (!src.find()) {
                continue;
            }
            String imageUrl = src.group(1);
            boolean highRes = imageUrl.contains("cdn.resize.sparkplatform.com") && DIMENSIONS.matcher(imageUrl).find();
            if (!highRes) {
                continue;
            }
            Matcher id = IMAGE_ID.matcher(imageUrl);
            String imageId = id.find() ? id.group(1) : imageUrl;
            if (seenIds.add(imageId)) {
                Matcher alt = ALT_ATTR.matcher(html);
                images.add(ListingImage.of(imageUrl, alt.find() ? alt.group(1) : null));
            }
        }
        return images;
    }

    List<ListingImage> pageImages(Document document) {
        List<ListingImage> images = new ArrayList<>();
        Set<String> seen = new LinkedHashSet<>();
        for (Element img : document.select("img[src]")) {
            String src = img.absUrl("src");
            if (src.isBlank()) {
                src = img.attr("src");
            }
            String lower = src.toLowerCase(Locale.ROOT);
            if (IGNORED_IMAGE_MARKERS.stream().anyMatch(lower::contains)) {
                continue;
            }
            if (seen.add(src)) {
                images.add(ListingImage.of(src, img.attr("alt").isBlank() ? null : img.attr("alt")));
            }
        }
        List<ListingImage> spark = images.stream()
            .filter(image -> {
                String lower = image.url().toLowerCase(Locale.ROOT);
                return lower.contains("cdn.resize.sparkplatform.com") || lower.contains("cdn.assets.flexmls.com");
            })
            .toList();
        return spark.isEmpty() ? images : new ArrayList<>(spark);
    }

    private String description(Document document) {
        String best = null;
        for (Element paragraph : document.select("p, div.remarks, .description")) {
            String text = paragraph.ownText().trim();
            if (text.length() <= 50) {
                continue;
            }
            String lower = text.toLowerCase(Locale.ROOT);
            if (DESCRIPTION_MARKERS.stream().anyMatch(lower::contains)) {
                best = text.length() > 500 ? text.substring(0, 500) : text;
                break;
            }
        }
        return best;
    }

    private String selectorNumber(Document document, String selectors) {
        Element element = document.selectFirst(selectors);
        if (element == null) {
            return null;
        }
        Matcher matcher = Pattern.compile("\\d[\\d,]*(?:\\.\\d+)?").matcher(element.text());
        return matcher.find() ? matcher.group() : null;
    }

    private static Double firstPrice(String text) {
        Matcher matcher = PRICE.matcher(text);
        while (matcher.find()) {
            Double value = JsonNodes.parseNumber(matcher.group());
            if (value != null && value > 0) {
                return value;
            }
        }
        return null;
    }

    private static String firstGroup(List<Pattern> candidates, String text) {
        for (Pattern pattern : candidates) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.groupCount() > 0 ? matcher.group(1) : matcher.group();
            }
        }
        return null;
    }

    private static Integer toInteger(String raw) {
        Double value = JsonNodes.parseNumber(raw);
        return value == null ? null : (int) Math.round(value);
    }

    private static Double pricePerSqft(Double price, Integer sqft) {
        if (price == null || sqft == null || sqft <= 0) {
            return null;
        }
        return (double) Math.round(price / sqft);
    }

    private static List<Pattern> patterns(String... regexes) {
        List<Pattern> out = new ArrayList<>();
        for (String regex : regexes) {
            out.add(Pattern.compile(regex, Pattern.CASE_INSENSITIVE));
        }
        return List.copyOf(out);
    }
}
