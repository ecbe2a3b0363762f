package com.gpu.tracker.microcenter.repository;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public interface SnapshotProjection {
    Long getProductId();
    String getBrand();
    String getModelName();
    String getManufacturer();
    String getFullName();
    Long getStoreId();
    String getStoreName();
    String getCity();
    String getState();
    String getSku();
    String getProductUrl();
    String getLastSeenImageUrl();
    BigDecimal getPrice();
    String getStockStatus();
    LocalDateTime getObservedAt();
}
