package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.model.RawListing;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListingExtractorTest {
    private static final String BASE_URL = "https://www.microcenter.com";

    private final ListingExtractor extractor = new ListingExtractor();
    private String html;

    @BeforeEach
    void loadPage() throws IOException {
        try (InputStream in = getClass().getResourceAsStream("/pages/search-results.html")) {
            assertThat(in).isNotNull();
            html = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    @Test
    void extractsWellFormedContainersAndSkipsBrokenOnes() {
        List<RawListing> listings = extractor.extract(html, BASE_URL);

        assertThat(listings).extracting(RawListing::getSku)
                .containsExactly("123456", "654321", "777777");
    }

    @Test
    void readsAttributesAndAbsolutisesLinks() {
        RawListing first = extractor.extract(html, BASE_URL).get(0);

        assertThat(first.getFullName()).isEqualTo("NVIDIA GeForce RTX 5070 Ti Founders Edition 12GB");
        assertThat(first.getBrand()).isEqualTo("NVIDIA");
        assertThat(first.getPrice()).isEqualByComparingTo(new BigDecimal("749.99"));
        assertThat(first.getProductUrl())
                .isEqualTo("https://www.microcenter.com/product/687201/nvidia-geforce-rtx-5070-ti-founders-edition");
        assertThat(first.getImageUrl()).isEqualTo("https://productimages.microcenter.com/687201.jpg");
    }

    @Test
    void stockTextFollowsFallbackOrder() {
        List<RawListing> listings = extractor.extract(html, BASE_URL);

        assertThat(listings.get(0).getStockStatus()).isEqualTo("12 NEW IN STOCK");
        assertThat(listings.get(1).getStockStatus()).isEqualTo("LIMITED AVAILABILITY");
        assertThat(listings.get(2).getStockStatus()).isEqualTo("SOLD OUT");
    }

    @Test
    void parsesThousandsSeparatorInPrice() {
        RawListing second = extractor.extract(html, BASE_URL).get(1);

        assertThat(second.getPrice()).isEqualByComparingTo(new BigDecimal("1099.00"));
        assertThat(second.getImageUrl()).isEqualTo("https://www.microcenter.com/images/690001.jpg");
    }

    @Test
    void missingImageAndStockFallBackToDefaults() {
        String page = """
                <ul><li class="product_wrapper">
                  <a class="productClickItemV2" href="/product/9" data-name="PNY GeForce RTX 5090 OC"></a>
                  <p class="sku">SKU: 999999</p>
                </li></ul>
                """;

        List<RawListing> listings = extractor.extract(page, BASE_URL);

        assertThat(listings).hasSize(1);
        RawListing listing = listings.get(0);
        assertThat(listing.getBrand()).isEqualTo("Unknown");
        assertThat(listing.getPrice()).isEqualByComparingTo("0.00");
        assertThat(listing.getStockStatus()).isEqualTo("UNKNOWN");
        assertThat(listing.getImageUrl()).isEqualTo("N/A");
    }

    @Test
    void emptyPageYieldsNoListings() {
        assertThat(extractor.extract("<html><body></body></html>", BASE_URL)).isEmpty();
        assertThat(extractor.extract(null, BASE_URL)).isEmpty();
    }
}
