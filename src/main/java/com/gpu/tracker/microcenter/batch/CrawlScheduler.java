package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.service.CrawlControlService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Slf4j
@Component
@ConditionalOnProperty(prefix = "app.crawl.schedule", name = "enabled", havingValue = "true")
public class CrawlScheduler {
    private final CrawlControlService crawlControlService;

    public CrawlScheduler(CrawlControlService crawlControlService) {
        this.crawlControlService = crawlControlService;
    }

    @Scheduled(cron = "${app.crawl.schedule.cron}", zone = "${app.crawl.schedule.zone:UTC}")
    public void runSweep() {
        log.info("Scheduled crawl of all stores triggered");
        if (!crawlControlService.startSweep()) {
            log.warn("Scheduled crawl skipped: a crawl is already running");
        }
    }
}
