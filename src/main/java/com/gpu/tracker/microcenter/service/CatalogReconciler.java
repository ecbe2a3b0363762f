package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.model.Gpu;
import com.gpu.tracker.microcenter.model.GpuIdentity;
import com.gpu.tracker.microcenter.model.GpuResolution;
import com.gpu.tracker.microcenter.model.PriceObservation;
import com.gpu.tracker.microcenter.model.Product;
import com.gpu.tracker.microcenter.model.Store;
import com.gpu.tracker.microcenter.repository.GpuRepository;
import com.gpu.tracker.microcenter.repository.PriceObservationRepository;
import com.gpu.tracker.microcenter.repository.ProductRepository;
import com.gpu.tracker.microcenter.repository.StoreRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * Maps scraped facts onto stable store, GPU and product rows and appends
 * price observations. Every method joins the caller's transaction, so one
 * crawl page commits or rolls back as a unit.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class CatalogReconciler {
    static final int TRUNCATED_MODEL_NAME = 99;
    static final String UNKNOWN_STOCK = "UNKNOWN";

    private final StoreRepository storeRepository;
    private final GpuRepository gpuRepository;
    private final ProductRepository productRepository;
    private final PriceObservationRepository priceObservationRepository;

    @Transactional
    public Long resolveStore(String name, String city, String state) {
        Optional<Store> existing = storeRepository.findByNameAndCity(name, city);
        if (existing.isPresent()) {
            return existing.get().getId();
        }
        Store created = storeRepository.save(new Store(name, city, state));
        log.info("Created new store: {}, {} -> storeId={}", name, city, created.getId());
        return created.getId();
    }

    /**
     * Looks the GPU up by its full name. An existing row is overwritten with the
     * incoming brand, model and manufacturer as soon as any one of them is a
     * better value; "Unknown" or blank values never replace what is stored.
     * A new row whose model name is too wide is retried once with the model
     * name cut to 99 characters.
     */
    @Transactional
    public GpuResolution resolveGpu(String brand, String modelName, String manufacturer, String fullName) {
        if (fullName == null || fullName.isBlank()) {
            return GpuResolution.failed("full name is blank");
        }
        Optional<Gpu> existing = gpuRepository.findByFullName(fullName);
        if (existing.isPresent()) {
            return GpuResolution.resolved(refreshGpu(existing.get(), brand, modelName, manufacturer));
        }

        GpuResolution first = insertGpu(brand, modelName, manufacturer, fullName);
        if (first.outcome() != GpuResolution.Outcome.NEEDS_TRUNCATION) {
            return first;
        }
        log.info("Retrying GPU insert with truncated model name: {}", fullName);
        GpuResolution retry = insertGpu(brand, truncate(modelName, TRUNCATED_MODEL_NAME), manufacturer, fullName);
        if (retry.outcome() == GpuResolution.Outcome.NEEDS_TRUNCATION) {
            return GpuResolution.failed(retry.reason());
        }
        return retry;
    }

    @Transactional
    public Long resolveProduct(Long storeId, Long gpuId, String sku, String productUrl, String imageUrl) {
        Optional<Product> existing = productRepository.findBySkuAndStoreId(sku, storeId);
        if (existing.isPresent()) {
            Product product = existing.get();
            product.setProductUrl(productUrl);
            product.setLastSeenImageUrl(imageUrl);
            productRepository.save(product);
            return product.getId();
        }
        if (!storeRepository.existsById(storeId)) {
            throw new IllegalStateException("Cannot link SKU " + sku + " to missing storeId=" + storeId);
        }
        if (!gpuRepository.existsById(gpuId)) {
            throw new IllegalStateException("Cannot link SKU " + sku + " to missing gpuId=" + gpuId);
        }
        Product created = productRepository.save(new Product(storeId, gpuId, sku, productUrl, imageUrl));
        log.info("Created new product entry for SKU: {} at storeId={}", sku, storeId);
        return created.getId();
    }

    @Transactional
    public Long recordObservation(Long productId, BigDecimal price, String stockStatus) {
        String status = stockStatus == null ? UNKNOWN_STOCK : truncate(stockStatus, PriceObservation.STOCK_STATUS_LENGTH);
        PriceObservation observation = new PriceObservation(productId, price == null ? BigDecimal.ZERO : price, status);
        return priceObservationRepository.save(observation).getId();
    }

    private Long refreshGpu(Gpu gpu, String brand, String modelName, String manufacturer) {
        String incomingModel = modelName == null || modelName.length() <= Gpu.MODEL_NAME_LENGTH
                ? modelName
                : truncate(modelName, TRUNCATED_MODEL_NAME);
        String incomingBrand = fits(brand, Gpu.BRAND_LENGTH) ? brand : null;
        String incomingManufacturer = fits(manufacturer, Gpu.MANUFACTURER_LENGTH) ? manufacturer : null;

        boolean better = isBetter(gpu.getBrand(), incomingBrand)
                || isBetter(gpu.getModelName(), incomingModel)
                || isBetter(gpu.getManufacturer(), incomingManufacturer);
        if (!better) {
            return gpu.getId();
        }
        gpu.setBrand(preferIncoming(gpu.getBrand(), incomingBrand));
        gpu.setModelName(preferIncoming(gpu.getModelName(), incomingModel));
        gpu.setManufacturer(preferIncoming(gpu.getManufacturer(), incomingManufacturer));
        gpuRepository.save(gpu);
        log.debug("Updated GPU {}: brand={} model={} manufacturer={}",
                gpu.getId(), gpu.getBrand(), gpu.getModelName(), gpu.getManufacturer());
        return gpu.getId();
    }

    private GpuResolution insertGpu(String brand, String modelName, String manufacturer, String fullName) {
        if (fullName.length() > Gpu.FULL_NAME_LENGTH) {
            return GpuResolution.failed("full name longer than " + Gpu.FULL_NAME_LENGTH + " characters");
        }
        if (!fits(brand, Gpu.BRAND_LENGTH)) {
            return GpuResolution.failed("brand longer than " + Gpu.BRAND_LENGTH + " characters");
        }
        if (!fits(manufacturer, Gpu.MANUFACTURER_LENGTH)) {
            return GpuResolution.failed("manufacturer longer than " + Gpu.MANUFACTURER_LENGTH + " characters");
        }
        if (modelName == null) {
            return GpuResolution.failed("model name is missing");
        }
        if (modelName.length() > Gpu.MODEL_NAME_LENGTH) {
            return GpuResolution.needsTruncation("model name longer than " + Gpu.MODEL_NAME_LENGTH + " characters");
        }
        Gpu created = gpuRepository.save(new Gpu(brand, modelName, manufacturer, fullName));
        log.info("Created new GPU: {} -> gpuId={}", fullName, created.getId());
        return GpuResolution.resolved(created.getId());
    }

    static boolean isBetter(String stored, String incoming) {
        return isUsable(incoming) && !incoming.equals(stored);
    }

    private static String preferIncoming(String stored, String incoming) {
        return isUsable(incoming) ? incoming : stored;
    }

    private static boolean isUsable(String value) {
        return value != null && !value.isBlank() && !GpuIdentity.UNKNOWN.equals(value);
    }

    private static boolean fits(String value, int length) {
        return value == null || value.length() <= length;
    }

    private static String truncate(String value, int length) {
        return value.length() <= length ? value : value.substring(0, length);
    }
}
