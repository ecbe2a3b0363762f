package com.gpu.tracker.microcenter.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.LocalDateTime;

public record CrawlStatusView(
        @JsonProperty("is_scraping") boolean scraping,
        CrawlPhase phase,
        String currentStore,
        String message,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        int pagesProcessed,
        long itemsRecorded
) {
}
