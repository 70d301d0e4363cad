package com.delta.listingimport.ingest.site;

import com.delta.listingimport.ingest.model.ListingSource;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

@Component
public class SiteDetector {
    private static final List<SiteRule> RULES = List.of(
        new SiteRule(ListingSource.FLEXMLS, Pattern.compile("^https?://(www\\.)?flexmls\\.com/share/.+", Pattern.CASE_INSENSITIVE)),
        new SiteRule(ListingSource.ZILLOW, Pattern.compile("^https?://(www\\.)?zillow\\.com/homedetails/.+", Pattern.CASE_INSENSITIVE)),
        new SiteRule(ListingSource.REALTOR, Pattern.compile("^https?://(www\\.)?realtor\\.com/realestateandhomes-detail/.+", Pattern.CASE_INSENSITIVE)),
        new SiteRule(ListingSource.TRULIA, Pattern.compile("^https?://(www\\.)?trulia\\.com/(p|home)/.+", Pattern.CASE_INSENSITIVE))
    );

    public ListingSource detect(String url) {
        if (!isWellFormed(url)) {
            return ListingSource.UNKNOWN;
        }
        String candidate = url.trim();
        for (SiteRule rule : RULES) {
            if (rule.pattern().matcher(candidate).find()) {
                return rule.source();
            }
        }
        return ListingSource.UNKNOWN;
    }

    public boolean isSupported(String url) {
        return detect(url) != ListingSource.UNKNOWN;
    }

    public String displayName(ListingSource source) {
        return source == null ? ListingSource.UNKNOWN.displayName() : source.displayName();
    }

    public List<ListingSource> supportedSources() {
        List<ListingSource> sources = new ArrayList<>();
        for (SiteRule rule : RULES) {
            sources.add(rule.source());
        }
        return sources;
    }

    static boolean isWellFormed(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        try {
            URI uri = new URI(url.trim());
            String scheme = uri.getScheme();
            if (scheme == null) {
                return false;
            }
            String lower = scheme.toLowerCase(Locale.ROOT);
            return (lower.equals("http") || lower.equals("https")) && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private record SiteRule(ListingSource source, Pattern pattern) {
    }
}
