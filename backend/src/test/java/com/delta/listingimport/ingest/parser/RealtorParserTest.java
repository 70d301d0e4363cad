package com.delta.listingimport.ingest.parser;

import com.delta.listingimport.ingest.model.ParsedProperty;
import com.delta.listingimport.ingest.model.UrlAddress;
import com.delta.listingimport.ingest.render.PageRenderer;
import com.delta.listingimport.ingest.render.StealthProfile;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.mockito.Mockito;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.verifyNoInteractions;

class RealtorParserTest {
    private static final String URL =
        "https://www.realtor.com/realestateandhomes-detail/742-Evergreen-Ter_Springfield_IL_62704_M12345-67890";

    private static final String NEXT_DATA = """
        {"props":{"pageProps":{"initialReduxState":{"propertyDetails":{
          "property_id":"1234567890",
          "list_price":315000,
          "status":"for_sale",
          "list_date":"2026-02-01",
          "location":{"address":{"line":"742 Evergreen Terrace","city":"Springfield","state_code":"IL","postal_code":"62704"}},
          "description":{"beds":3,"baths_consolidated":"2.5","sqft":1500,"year_built":1978,"lot_sqft":7405,"type":"single_family","text":"Corner lot with mature trees"},
          "photos":[{"href":"https://ap.rdcpix.com/1.jpg"},{"href":"https://ap.rdcpix.com/2.jpg"},{"href":"https://ap.rdcpix.com/1.jpg"}],
          "advertisers":[{"name":"Jo Agent","office":{"name":"Acme Realty"}}],
          "source":{"listing_id":"MLS-1"},
          "local":{"flood":{"flood_factor_severity":"minimal"}}
        }}}}}
        """;

    private final ObjectMapper objectMapper = ParserTestSupport.objectMapper();

    private RealtorParser parser(PageRenderer renderer) {
        return new RealtorParser(
            renderer,
            new StealthProfile(ParserTestSupport.properties()),
            ParserTestSupport.properties(),
            objectMapper,
            ParserTestSupport.CLOCK,
            new RealtorJsonMapper(objectMapper)
        );
    }

    @Test
    void extractsAddressAndListingIdFromUnderscoreSlug() {
        UrlAddress address = parser(Mockito.mock(PageRenderer.class)).extractAddressFromUrl(URL);

        assertThat(address.sourceId()).isEqualTo("M12345-67890");
        assertThat(address.address().full()).isEqualTo("742 Evergreen Ter, Springfield, IL 62704");
    }

    @Test
    void addressExtractionIsRepeatableWithoutRendering() {
        PageRenderer renderer = Mockito.mock(PageRenderer.class);
        RealtorParser parser = parser(renderer);

        UrlAddress first = parser.extractAddressFromUrl(URL);
        UrlAddress second = parser.extractAddressFromUrl(URL);

        assertThat(second).isEqualTo(first);
        assertThat(first.address()).isNotNull();
        verifyNoInteractions(renderer);
    }

    @Test
    void detailPagesScoreHigherThanSearchPages() {
        RealtorParser parser = parser(Mockito.mock(PageRenderer.class));

        assertThat(parser.confidence(URL)).isEqualTo(0.95);
        assertThat(parser.confidence("https://www.realtor.com/realestateandhomes-search/Springfield_IL")).isEqualTo(0.5);
        assertThat(parser.confidence("https://www.realtor.com/news/")).isEqualTo(0.0);
    }

    @Test
    void mapsPropertyDetailsFromNextData() {
        ParsedProperty parsed = parser(ParserTestSupport.rendererReturning(ParserTestSupport.nextDataPage(NEXT_DATA))).parse(URL);

        assertThat(parsed.sourceId()).isEqualTo("1234567890");
        assertThat(parsed.address().street()).isEqualTo("742 Evergreen Terrace");
        assertThat(parsed.pricing().displayPrice()).isEqualTo("$315,000");
        assertThat(parsed.pricing().pricePerSqft()).isEqualTo(210.0);
        assertThat(parsed.propertyDetails().baths()).isEqualTo(2.5);
        assertThat(parsed.propertyDetails().lotSize()).isEqualTo("7,405 sqft");
        assertThat(parsed.propertyDetails().propertyType()).isEqualTo("single_family");
        assertThat(parsed.listingInfo().mlsNumber()).isEqualTo("MLS-1");
        assertThat(parsed.listingInfo().officeName()).isEqualTo("Acme Realty");
        assertThat(parsed.images()).hasSize(2);
        assertThat(parsed.rawExtra())
            .containsEntry("description", "Corner lot with mature trees")
            .containsEntry("flood_risk", "minimal");
    }

    @Test
    void fallsBackToUrlAddressWhenPropertyIsMissing() {
        String page = ParserTestSupport.nextDataPage("{\"props\":{\"pageProps\":{\"other\":{}}}}");

        ParsedProperty parsed = parser(ParserTestSupport.rendererReturning(page)).parse(URL);

        assertThat(parsed.address().full()).isEqualTo("742 Evergreen Ter, Springfield, IL 62704");
        assertThat(parsed.diagnostics()).containsExactly("Property data not found in pageProps");
    }
}
