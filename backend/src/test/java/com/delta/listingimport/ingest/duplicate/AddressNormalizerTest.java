package com.delta.listingimport.ingest.duplicate;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class AddressNormalizerTest {

    @Test
    void normalizesCasePunctuationAndWhitespace() {
        assertThat(AddressNormalizer.normalize("  123 Main St.,  Phoenix, AZ 85001 "))
            .isEqualTo("123 main st phoenix az 85001");
        assertThat(AddressNormalizer.normalize("123 MAIN ST, PHOENIX, AZ 85001"))
            .isEqualTo(AddressNormalizer.normalize("123 main st phoenix az 85001"));
        assertThat(AddressNormalizer.normalize(" ,. ")).isNull();
        assertThat(AddressNormalizer.normalize(null)).isNull();
    }

    @Test
    void bucketsPrices() {
        assertThat(AddressNormalizer.priceRange(150_000.0)).isEqualTo("under_200k");
        assertThat(AddressNormalizer.priceRange(200_000.0)).isEqualTo("200k_300k");
        assertThat(AddressNormalizer.priceRange(499_999.0)).isEqualTo("300k_500k");
        assertThat(AddressNormalizer.priceRange(600_000.0)).isEqualTo("500k_750k");
        assertThat(AddressNormalizer.priceRange(999_000.0)).isEqualTo("750k_1m");
        assertThat(AddressNormalizer.priceRange(2_500_000.0)).isEqualTo("over_1m");
        assertThat(AddressNormalizer.priceRange(0.0)).isNull();
        assertThat(AddressNormalizer.priceRange(null)).isNull();
    }
}
