package com.gpu.tracker.microcenter.api;

import com.gpu.tracker.microcenter.model.PriceHistoryPointDTO;
import com.gpu.tracker.microcenter.model.ProductSnapshotDTO;
import com.gpu.tracker.microcenter.service.PriceQueryService;
import org.springframework.http.HttpHeaders;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class PriceController {
    private final PriceQueryService priceQueryService;

    public PriceController(PriceQueryService priceQueryService) {
        this.priceQueryService = priceQueryService;
    }

    @GetMapping("/gpus")
    public ResponseEntity<List<ProductSnapshotDTO>> latest() {
        return ResponseEntity.ok()
                .header(HttpHeaders.CACHE_CONTROL, "no-cache, no-store, must-revalidate")
                .header(HttpHeaders.PRAGMA, "no-cache")
                .header(HttpHeaders.EXPIRES, "0")
                .body(priceQueryService.listLatest());
    }

    @GetMapping("/history/{productId}")
    public List<PriceHistoryPointDTO> history(@PathVariable Long productId) {
        return priceQueryService.history(productId);
    }
}
