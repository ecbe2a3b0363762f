package com.gpu.tracker.microcenter.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;
import java.time.LocalDateTime;

@Data
@AllArgsConstructor
public class ProductSnapshotDTO {
    private Long productId;
    private String brand;
    private String modelName;
    private String manufacturer;
    private String fullName;
    private Long storeId;
    private String storeName;
    private String city;
    private String state;
    private String sku;
    private String productUrl;
    private String lastSeenImageUrl;
    private BigDecimal priceUsd;
    private String stockStatus;
    private LocalDateTime scrapedAt;
}
