package com.delta.listingimport.ingest.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public final class UrlPaths {
    private UrlPaths() {
    }

    public static URI parse(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            URI uri = new URI(url.trim());
            if (uri.getScheme() == null || uri.getHost() == null) {
                return null;
            }
            String scheme = uri.getScheme().toLowerCase(Locale.ROOT);
            if (!scheme.equals("http") && !scheme.equals("https")) {
                return null;
            }
            return uri;
        } catch (URISyntaxException e) {
            return null;
        }
    }

    public static String host(String url) {
        URI uri = parse(url);
        return uri == null ? null : uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static boolean hostMatches(String url, String domain) {
        String host = host(url);
        return host != null && (host.equals(domain) || host.endsWith("." + domain));
    }

    public static String rawPath(String url) {
        URI uri = parse(url);
        if (uri == null || uri.getPath() == null) {
            return "";
        }
        return uri.getPath();
    }

    /**
     * Non-empty path segments, decoded.
     */
    public static List<String> segments(String url) {
        List<String> out = new ArrayList<>();
        for (String part : rawPath(url).split("/")) {
            if (!part.isEmpty()) {
                out.add(part);
            }
        }
        return out;
    }

    public static String capitalize(String word) {
        if (word == null || word.isEmpty()) {
            return word;
        }
        return Character.toUpperCase(word.charAt(0)) + word.substring(1);
    }

    public static String titleCase(List<String> words) {
        List<String> out = new ArrayList<>();
        for (String word : words) {
            if (!word.isEmpty()) {
                out.add(capitalize(word));
            }
        }
        return String.join(" ", out);
    }
}
