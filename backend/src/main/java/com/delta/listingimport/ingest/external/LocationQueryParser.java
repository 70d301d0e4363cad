package com.delta.listingimport.ingest.external;

import com.delta.listingimport.ingest.error.ValidationException;
import org.springframework.stereotype.Component;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Turns free-form location text ("Austin, TX", "123 Main St, Louisville, KY 40202", "78701", "Miami")
 * into the city/state/zip triple the search endpoint takes. Only the last two comma-separated parts are
 * searched for a state code, so street suffixes like "Dr" never match.
 */
@Component
public class LocationQueryParser {
    private static final Pattern STATE_CODE = Pattern.compile("\\b([A-Z]{2})\\b");
    private static final Pattern ZIP = Pattern.compile("\\b(\\d{5})\\b");
    private static final Map<String, String> KNOWN_CITIES = knownCities();

    public LocationQuery parse(String input) {
        if (input == null || input.isBlank()) {
            throw new ValidationException("Location is required, e.g. \"Louisville, KY\"");
        }
        String trimmed = input.trim();
        Matcher zipMatcher = ZIP.matcher(trimmed);
        String zip = zipMatcher.find() ? zipMatcher.group(1) : null;

        List<String> parts = Arrays.stream(trimmed.split(","))
            .map(String::trim)
            .filter(part -> !part.isEmpty())
            .collect(Collectors.toList());
        if (parts.isEmpty()) {
            throw new ValidationException("Location is required, e.g. \"Louisville, KY\"");
        }

        String tail = String.join(" ", parts.subList(Math.max(0, parts.size() - 2), parts.size()));
        Matcher stateMatcher = STATE_CODE.matcher(tail);
        if (stateMatcher.find()) {
            String state = stateMatcher.group(1);
            String rawCity = parts.size() == 1 ? parts.get(0) : parts.get(parts.size() - 2);
            String city = cleanCity(rawCity);
            if (city.isEmpty() && parts.size() == 1) {
                city = parts.get(0).split("\\s+")[0];
            }
            return finish(city, state, zip, input);
        }

        String last = cleanCity(parts.get(parts.size() - 1));
        String lookup = last.toLowerCase(Locale.ROOT);
        if (!lookup.isEmpty()) {
            for (Map.Entry<String, String> entry : KNOWN_CITIES.entrySet()) {
                if (lookup.contains(entry.getKey()) || entry.getKey().contains(lookup)) {
                    return finish(last, entry.getValue(), zip, input);
                }
            }
        }
        if (zip != null) {
            return new LocationQuery(null, null, zip);
        }
        throw new ValidationException(
            "State code not found in \"" + input + "\". Include the state, e.g. \"Louisville, KY\""
        );
    }

    private LocationQuery finish(String city, String state, String zip, String input) {
        if (zip == null && (city == null || city.length() < 2)) {
            throw new ValidationException("Could not extract a city name from \"" + input + "\"");
        }
        return new LocationQuery(city == null || city.isEmpty() ? null : city, state, zip);
    }

    private static String cleanCity(String raw) {
        return raw.replaceFirst("\\b[A-Z]{2}\\b", "")
            .replaceAll("\\d+", "")
            .replaceAll("\\s+", " ")
            .trim();
    }

    private static Map<String, String> knownCities() {
        Map<String, String> cities = new LinkedHashMap<>();
        cities.put("louisville", "KY");
        cities.put("lexington", "KY");
        cities.put("new york", "NY");
        cities.put("los angeles", "CA");
        cities.put("chicago", "IL");
        cities.put("houston", "TX");
        cities.put("phoenix", "AZ");
        cities.put("philadelphia", "PA");
        cities.put("san antonio", "TX");
        cities.put("san diego", "CA");
        cities.put("dallas", "TX");
        cities.put("san jose", "CA");
        cities.put("austin", "TX");
        cities.put("jacksonville", "FL");
        cities.put("miami", "FL");
        return Collections.unmodifiableMap(cities);
    }
}
