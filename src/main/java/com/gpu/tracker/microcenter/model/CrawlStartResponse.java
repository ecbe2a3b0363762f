package com.gpu.tracker.microcenter.model;

public record CrawlStartResponse(String status, String storeId, String message) {
    public static final String STARTED = "started";
    public static final String BUSY = "busy";
}
