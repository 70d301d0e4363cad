package com.delta.listingimport.ingest.api;

import com.delta.listingimport.ingest.error.ValidationException;
import com.delta.listingimport.ingest.model.ListingSource;
import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.parser.ListingParser;
import com.delta.listingimport.ingest.parser.ParserFactory;
import com.delta.listingimport.ingest.site.SiteDetector;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

@RestController
@RequestMapping("/api/parsers")
public class ParserController {
    private final ParserFactory parserFactory;
    private final SiteDetector siteDetector;

    public ParserController(ParserFactory parserFactory, SiteDetector siteDetector) {
        this.parserFactory = parserFactory;
        this.siteDetector = siteDetector;
    }

    @GetMapping("/detect")
    public Map<String, Object> detect(@RequestParam("url") String url) {
        ListingSource source = siteDetector.detect(url);
        Optional<ListingParser> parser = parserFactory.getParser(url);
        Map<String, Object> response = new LinkedHashMap<>();
        response.put("url", url);
        response.put("source", source);
        response.put("displayName", siteDetector.displayName(source));
        response.put("supported", parser.isPresent());
        response.put("parser", parser.map(ListingParser::name).orElse(null));
        response.put("confidence", parser.map(p -> p.confidence(url)).orElse(0.0));
        return response;
    }

    @GetMapping("/address")
    public UrlAddress address(@RequestParam("url") String url) {
        return requireParser(url).extractAddressFromUrl(url);
    }

    @GetMapping("/stats")
    public Map<String, Object> stats() {
        return parserFactory.stats();
    }

    @PostMapping("/quick")
    public ParsedProperty quickParse(@RequestParam("url") String url) {
        return requireParser(url).quickParse(url);
    }

    @PostMapping("/parse")
    public ParsedProperty parse(@RequestParam("url") String url) {
        return requireParser(url).parse(url);
    }

    private ListingParser requireParser(String url) {
        return parserFactory.getParser(url)
            .orElseThrow(() -> new ValidationException("No parser available for URL: " + url));
    }
}
