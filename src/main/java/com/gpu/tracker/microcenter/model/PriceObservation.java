package com.gpu.tracker.microcenter.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.math.BigDecimal;
import java.time.LocalDateTime;

/**
 * One price/stock reading of a product. Rows are only ever inserted; the
 * latest state of a product is the row with the highest id.
 */
@Entity
@Table(
        name = "price_observations",
        indexes = {
                @Index(name = "idx_price_observations_product_id", columnList = "productId"),
                @Index(name = "idx_price_observations_observed_at", columnList = "observedAt")
        }
)
@Data
@NoArgsConstructor
public class PriceObservation {
    public static final int STOCK_STATUS_LENGTH = 50;
    public static final int PRICE_PRECISION = 10;
    public static final int PRICE_SCALE = 2;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(nullable = false, updatable = false)
    private Long productId;

    @Column(nullable = false, updatable = false, precision = PRICE_PRECISION, scale = PRICE_SCALE)
    private BigDecimal price;

    @Column(nullable = false, updatable = false, length = STOCK_STATUS_LENGTH)
    private String stockStatus;

    @Column(nullable = false, updatable = false)
    private LocalDateTime observedAt = LocalDateTime.now();

    public PriceObservation(Long productId, BigDecimal price, String stockStatus) {
        this.productId = productId;
        this.price = price;
        this.stockStatus = stockStatus;
    }
}
