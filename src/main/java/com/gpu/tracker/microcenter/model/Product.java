package com.gpu.tracker.microcenter.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "products",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_products_sku_store", columnNames = {"sku", "storeId"})
        },
        indexes = {
                @Index(name = "idx_products_store_id", columnList = "storeId"),
                @Index(name = "idx_products_gpu_id", columnList = "gpuId")
        }
)
@Data
@NoArgsConstructor
public class Product {
    public static final int SKU_LENGTH = 45;
    public static final int URL_LENGTH = 2048;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long storeId;

    @Column(nullable = false, updatable = false)
    private Long gpuId;

    @Column(nullable = false, updatable = false, length = SKU_LENGTH)
    private String sku;

    @Column(length = URL_LENGTH)
    private String productUrl;

    @Column(length = URL_LENGTH)
    private String lastSeenImageUrl;

    public Product(Long storeId, Long gpuId, String sku, String productUrl, String lastSeenImageUrl) {
        this.storeId = storeId;
        this.gpuId = gpuId;
        this.sku = sku;
        this.productUrl = productUrl;
        this.lastSeenImageUrl = lastSeenImageUrl;
    }
}
