package com.gpu.tracker.microcenter.model;

import lombok.AllArgsConstructor;
import lombok.Data;

import java.math.BigDecimal;

@Data
@AllArgsConstructor
public class RawListing {
    private String fullName;
    private String brand;
    private BigDecimal price;
    private String sku;
    private String stockStatus;
    private String imageUrl;
    private String productUrl;
}
