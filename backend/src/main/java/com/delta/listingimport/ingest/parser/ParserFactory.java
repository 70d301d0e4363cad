package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.site.SiteDetector;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of one parser per listing source. Resolution asks every registered parser whether it can
 * handle the URL and keeps the highest confidence; on a tie the parser for the detected source wins.
 */
@Service
public class ParserFactory {
    private static final Logger log = LoggerFactory.getLogger(ParserFactory.class);

    private final SiteDetector siteDetector;
    private final Map<ListingSource, ListingParser> parsers = new EnumMap<>(ListingSource.class);

    public ParserFactory(SiteDetector siteDetector, List<ListingParser> registered) {
        this.siteDetector = siteDetector;
        for (ListingParser parser : registered) {
            ListingParser previous = parsers.putIfAbsent(parser.source(), parser);
            if (previous != null) {
                throw new IllegalStateException(
                    "Two parsers registered for " + parser.source() + ": " + previous.name() + ", " + parser.name()
                );
            }
        }
        log.info("Registered listing parsers: {}", parsers.keySet());
    }

    public ListingSource detectSource(String url) {
        return siteDetector.detect(url);
    }

    public Optional<ListingParser> getParser(String url) {
        ListingSource detected = siteDetector.detect(url);
        ListingParser best = null;
        double bestConfidence = 0.0;
        for (ListingParser parser : parsers.values()) {
            if (!parser.canHandle(url)) {
                continue;
            }
            double confidence = parser.confidence(url);
            if (confidence <= 0.0) {
                continue;
            }
            boolean better = best == null
                || confidence > bestConfidence
                || (confidence == bestConfidence && parser.source() == detected && best.source() != detected);
            if (better) {
                best = parser;
                bestConfidence = confidence;
            }
        }
        if (best == null) {
            log.debug("No parser for {} (detected {})", url, detected);
            return Optional.empty();
        }
        log.info("Using {} parser for {} with confidence {}", best.name(), url, bestConfidence);
        return Optional.of(best);
    }

    public Optional<ListingParser> getParserBySource(ListingSource source) {
        return Optional.ofNullable(parsers.get(source));
    }

    public boolean canParse(String url) {
        return getParser(url).isPresent();
    }

    public List<ListingSource> registeredSources() {
        return Collections.unmodifiableList(new ArrayList<>(parsers.keySet()));
    }

    public Map<String, Object> stats() {
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("registeredParsers", parsers.size());
        List<String> names = new ArrayList<>();
        for (ListingParser parser : parsers.values()) {
            names.add(parser.name());
        }
        stats.put("sources", names);
        return stats;
    }
}
