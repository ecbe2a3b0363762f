package com.gpu.tracker.microcenter.model;

import java.math.BigDecimal;
import java.time.LocalDateTime;

public record PriceHistoryPointDTO(
        Long historyId,
        BigDecimal priceUsd,
        String stockStatus,
        LocalDateTime scrapedAt
) {
}
