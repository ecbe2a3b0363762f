package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.PriceHistoryPointDTO;
import com.gpu.tracker.microcenter.model.ProductSnapshotDTO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.orm.jpa.DataJpaTest;
import org.springframework.context.annotation.Import;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DataJpaTest
@Import({CatalogReconciler.class, PriceQueryService.class})
class PriceQueryServiceTest {
    @Autowired
    private CatalogReconciler reconciler;
    @Autowired
    private PriceQueryService queryService;

    private Long storeId;

    @BeforeEach
    void setUp() {
        storeId = reconciler.resolveStore("Denver", "Denver", "CO");
    }

    @Test
    void emptyStoreReturnsEmptyList() {
        assertThat(queryService.listLatest()).isEmpty();
    }

    @Test
    void snapshotShowsMostRecentObservation() {
        Long productId = product("123456", "MSI NVIDIA GeForce RTX 5070 Ti", "GeForce RTX 5070 Ti");
        reconciler.recordObservation(productId, new BigDecimal("799.99"), "5 IN STOCK");
        reconciler.recordObservation(productId, new BigDecimal("749.99"), "3 IN STOCK");

        List<ProductSnapshotDTO> latest = queryService.listLatest();

        assertThat(latest).hasSize(1);
        ProductSnapshotDTO row = latest.get(0);
        assertThat(row.getProductId()).isEqualTo(productId);
        assertThat(row.getPriceUsd()).isEqualByComparingTo("749.99");
        assertThat(row.getStockStatus()).isEqualTo("3 IN STOCK");
        assertThat(row.getStoreName()).isEqualTo("Denver");
        assertThat(row.getState()).isEqualTo("CO");
        assertThat(row.getModelName()).isEqualTo("GeForce RTX 5070 Ti");
        assertThat(row.getManufacturer()).isEqualTo("NVIDIA");
        assertThat(row.getSku()).isEqualTo("123456");
        assertThat(row.getScrapedAt()).isNotNull();
    }

    @Test
    void snapshotIsOrderedByPriceDescending() {
        Long cheap = product("111111", "Sparkle Intel Arc B580", "Arc B580");
        Long pricey = product("222222", "ASUS NVIDIA GeForce RTX 5090", "GeForce RTX 5090");
        Long middle = product("333333", "ASUS AMD Radeon RX 9070 XT", "Radeon RX 9070 XT");
        reconciler.recordObservation(cheap, new BigDecimal("249.99"), "IN STOCK");
        reconciler.recordObservation(pricey, new BigDecimal("1999.99"), "IN STOCK");
        reconciler.recordObservation(middle, new BigDecimal("699.99"), "IN STOCK");

        List<ProductSnapshotDTO> latest = queryService.listLatest();

        assertThat(latest).extracting(ProductSnapshotDTO::getProductId).containsExactly(pricey, middle, cheap);
    }

    @Test
    void productWithoutObservationsIsNotListed() {
        product("444444", "MSI NVIDIA GeForce RTX 5060", "GeForce RTX 5060");

        assertThat(queryService.listLatest()).isEmpty();
    }

    @Test
    void historyIsInRecordingOrder() {
        Long productId = product("123456", "MSI NVIDIA GeForce RTX 5070 Ti", "GeForce RTX 5070 Ti");
        reconciler.recordObservation(productId, new BigDecimal("799.99"), "5 IN STOCK");
        reconciler.recordObservation(productId, new BigDecimal("749.99"), "3 IN STOCK");
        reconciler.recordObservation(productId, new BigDecimal("779.99"), "SOLD OUT");

        List<PriceHistoryPointDTO> history = queryService.history(productId);

        assertThat(history).extracting(PriceHistoryPointDTO::stockStatus)
                .containsExactly("5 IN STOCK", "3 IN STOCK", "SOLD OUT");
        assertThat(history.get(0).historyId()).isLessThan(history.get(2).historyId());
    }

    @Test
    void historyOfUnknownProductIsEmpty() {
        assertThat(queryService.history(987654L)).isEmpty();
    }

    @Test
    void historyRejectsNonPositiveIds() {
        assertThatThrownBy(() -> queryService.history(0L)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> queryService.history(null)).isInstanceOf(IllegalArgumentException.class);
    }

    private Long product(String sku, String fullName, String modelName) {
        Long gpuId = reconciler.resolveGpu("MSI", modelName, detect(fullName), fullName).gpuId();
        return reconciler.resolveProduct(storeId, gpuId, sku, "https://www.microcenter.com/product/" + sku, "N/A");
    }

    private static String detect(String fullName) {
        if (fullName.contains("NVIDIA")) {
            return "NVIDIA";
        }
        return fullName.contains("AMD") ? "AMD" : "Intel";
    }
}
