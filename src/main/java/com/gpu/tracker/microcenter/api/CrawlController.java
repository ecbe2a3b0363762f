package com.gpu.tracker.microcenter.api;

import com.gpu.tracker.microcenter.model.CrawlStartResponse;
import com.gpu.tracker.microcenter.model.CrawlStatusView;
import com.gpu.tracker.microcenter.model.StoreDescriptor;
import com.gpu.tracker.microcenter.service.CrawlControlService;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api")
public class CrawlController {
    private final CrawlControlService crawlControlService;

    public CrawlController(CrawlControlService crawlControlService) {
        this.crawlControlService = crawlControlService;
    }

    @GetMapping("/stores")
    public List<StoreDescriptor> stores() {
        return crawlControlService.listStores();
    }

    @GetMapping("/status")
    public CrawlStatusView status() {
        return crawlControlService.status();
    }

    @PostMapping("/scrape")
    public ResponseEntity<CrawlStartResponse> scrape(@RequestBody ScrapeRequest request) {
        CrawlStartResponse response = crawlControlService.startCrawl(request.storeId());
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(response);
    }
}
