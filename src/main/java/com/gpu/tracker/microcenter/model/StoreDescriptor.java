package com.gpu.tracker.microcenter.model;

public record StoreDescriptor(
        String id,
        String name,
        String city,
        String state
) {
}
