package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.Gpu;
import com.gpu.tracker.microcenter.repository.GpuRepository;
import com.gpu.tracker.microcenter.repository.PriceObservationRepository;
import com.gpu.tracker.microcenter.repository.ProductRepository;
import com.gpu.tracker.microcenter.repository.StoreRepository;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class CatalogReconcilerUnitTest {
    @Mock
    private StoreRepository storeRepository;
    @Mock
    private GpuRepository gpuRepository;
    @Mock
    private ProductRepository productRepository;
    @Mock
    private PriceObservationRepository priceObservationRepository;
    @InjectMocks
    private CatalogReconciler reconciler;

    @Test
    void identicalValuesDoNotRewriteGpu() {
        Gpu stored = new Gpu("ASUS", "Radeon RX 9070 XT", "AMD", "ASUS AMD Radeon RX 9070 XT");
        stored.setId(7L);
        when(gpuRepository.findByFullName(stored.getFullName())).thenReturn(Optional.of(stored));

        Long id = reconciler.resolveGpu("ASUS", "Radeon RX 9070 XT", "AMD", stored.getFullName()).gpuId();

        assertThat(id).isEqualTo(7L);
        verify(gpuRepository, never()).save(any());
    }

    @Test
    void unknownIncomingValuesAreNotBetter() {
        assertThat(CatalogReconciler.isBetter("ASUS", "Unknown")).isFalse();
        assertThat(CatalogReconciler.isBetter("ASUS", "")).isFalse();
        assertThat(CatalogReconciler.isBetter("ASUS", null)).isFalse();
        assertThat(CatalogReconciler.isBetter("ASUS", "ASUS")).isFalse();
        assertThat(CatalogReconciler.isBetter("Unknown", "ASUS")).isTrue();
        assertThat(CatalogReconciler.isBetter("MSI", "ASUS")).isTrue();
    }
}
