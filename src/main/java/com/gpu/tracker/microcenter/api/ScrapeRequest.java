package com.gpu.tracker.microcenter.api;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ScrapeRequest(@JsonProperty("store_id") String storeId) {
}
