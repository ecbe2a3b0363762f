package com.gpu.tracker.microcenter.model;

/**
 * Result of resolving a GPU row. {@code NEEDS_TRUNCATION} is only seen between
 * the first insert attempt and its single retry; callers get either
 * {@code RESOLVED} or {@code FAILED}.
 */
public record GpuResolution(Outcome outcome, Long gpuId, String reason) {

    public enum Outcome {
        RESOLVED,
        NEEDS_TRUNCATION,
        FAILED
    }

    public static GpuResolution resolved(Long gpuId) {
        return new GpuResolution(Outcome.RESOLVED, gpuId, null);
    }

    public static GpuResolution needsTruncation(String reason) {
        return new GpuResolution(Outcome.NEEDS_TRUNCATION, null, reason);
    }

    public static GpuResolution failed(String reason) {
        return new GpuResolution(Outcome.FAILED, null, reason);
    }

    public boolean isResolved() {
        return outcome == Outcome.RESOLVED;
    }
}
