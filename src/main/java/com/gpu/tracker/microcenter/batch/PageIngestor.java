package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.model.GpuIdentity;
import com.gpu.tracker.microcenter.model.GpuResolution;
import com.gpu.tracker.microcenter.model.PageResult;
import com.gpu.tracker.microcenter.model.PriceObservation;
import com.gpu.tracker.microcenter.model.Product;
import com.gpu.tracker.microcenter.model.RawListing;
import com.gpu.tracker.microcenter.model.StoreDescriptor;
import com.gpu.tracker.microcenter.service.CatalogReconciler;
import com.gpu.tracker.microcenter.service.GpuClassifier;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.List;

/**
 * Classifies and records one page of listings inside a single transaction.
 * Listings the reconciler refuses are skipped; any exception rolls back the
 * whole page.
 */
@Slf4j
@Component
public class PageIngestor {
    private final GpuClassifier classifier;
    private final CatalogReconciler reconciler;
    private final TransactionTemplate transactionTemplate;

    public PageIngestor(GpuClassifier classifier,
                        CatalogReconciler reconciler,
                        PlatformTransactionManager transactionManager) {
        this.classifier = classifier;
        this.reconciler = reconciler;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
    }

    public PageResult ingest(StoreDescriptor store, List<RawListing> listings) {
        return transactionTemplate.execute(status -> {
            Long storeId = reconciler.resolveStore(store.name(), store.city(), store.state());
            int recorded = 0;
            for (RawListing listing : listings) {
                if (record(storeId, listing)) {
                    recorded++;
                }
            }
            return new PageResult(storeId, listings.size(), recorded, listings.size() - recorded);
        });
    }

    private boolean record(Long storeId, RawListing listing) {
        String rejection = rejectionReason(listing);
        if (rejection != null) {
            log.warn("Skipping SKU {} ({}): {}", listing.getSku(), listing.getFullName(), rejection);
            return false;
        }
        GpuIdentity identity = classifier.classify(listing.getFullName(), listing.getBrand());
        GpuResolution gpu = reconciler.resolveGpu(
                identity.brand(),
                identity.modelName(),
                identity.manufacturer(),
                listing.getFullName()
        );
        if (!gpu.isResolved()) {
            log.warn("Skipping SKU {} ({}): {}", listing.getSku(), listing.getFullName(), gpu.reason());
            return false;
        }
        Long productId = reconciler.resolveProduct(
                storeId,
                gpu.gpuId(),
                listing.getSku(),
                listing.getProductUrl(),
                listing.getImageUrl()
        );
        reconciler.recordObservation(productId, listing.getPrice(), listing.getStockStatus());
        return true;
    }

    // a value the columns cannot hold would abort the whole page transaction
    static String rejectionReason(RawListing listing) {
        String sku = listing.getSku();
        if (sku == null || sku.isBlank()) {
            return "SKU is missing";
        }
        if (sku.length() > Product.SKU_LENGTH) {
            return "SKU longer than " + Product.SKU_LENGTH + " characters";
        }
        if (tooLong(listing.getProductUrl(), Product.URL_LENGTH)) {
            return "product URL longer than " + Product.URL_LENGTH + " characters";
        }
        if (tooLong(listing.getImageUrl(), Product.URL_LENGTH)) {
            return "image URL longer than " + Product.URL_LENGTH + " characters";
        }
        BigDecimal price = listing.getPrice();
        if (price != null && price.setScale(PriceObservation.PRICE_SCALE, RoundingMode.HALF_UP).precision()
                > PriceObservation.PRICE_PRECISION) {
            return "price " + price.toPlainString() + " does not fit DECIMAL("
                    + PriceObservation.PRICE_PRECISION + "," + PriceObservation.PRICE_SCALE + ")";
        }
        return null;
    }

    private static boolean tooLong(String value, int length) {
        return value != null && value.length() > length;
    }
}
