package com.gpu.tracker.microcenter.model;

public record GpuIdentity(
        String brand,
        String manufacturer,
        String modelName
) {
    public static final String UNKNOWN = "Unknown";
}
