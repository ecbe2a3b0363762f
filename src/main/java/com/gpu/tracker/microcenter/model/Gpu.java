package com.gpu.tracker.microcenter.model;

import jakarta.persistence.*;
import lombok.Data;
import lombok.NoArgsConstructor;

@Entity
@Table(
        name = "gpus",
        uniqueConstraints = {
                @UniqueConstraint(name = "uk_gpus_full_name", columnNames = {"fullName"})
        }
)
@Data
@NoArgsConstructor
public class Gpu {
    public static final int BRAND_LENGTH = 45;
    public static final int MODEL_NAME_LENGTH = 100;
    public static final int MANUFACTURER_LENGTH = 100;
    public static final int FULL_NAME_LENGTH = 255;

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(length = BRAND_LENGTH)
    private String brand;

    @Column(length = MANUFACTURER_LENGTH)
    private String manufacturer;

    @Column(nullable = false, length = MODEL_NAME_LENGTH)
    private String modelName;

    // raw scraped name; the natural key because model parsing is heuristic
    @Column(nullable = false, length = FULL_NAME_LENGTH)
    private String fullName;

    public Gpu(String brand, String modelName, String manufacturer, String fullName) {
        this.brand = brand;
        this.modelName = modelName;
        this.manufacturer = manufacturer;
        this.fullName = fullName;
    }
}
