package com.gpu.tracker.microcenter.model;

public record PageResult(
        Long storeId,
        int itemsFound,
        int itemsRecorded,
        int itemsSkipped
) {
}
