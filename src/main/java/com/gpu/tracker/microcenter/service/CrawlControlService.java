package com.gpu.tracker.microcenter.service;

import com.gpu.tracker.microcenter.batch.StoreCrawlTasklet;
import com.gpu.tracker.microcenter.config.CrawlProperties;
import com.gpu.tracker.microcenter.model.CrawlStartResponse;
import com.gpu.tracker.microcenter.model.CrawlStatusView;
import com.gpu.tracker.microcenter.model.StoreDescriptor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionException;
import org.springframework.batch.core.JobParameters;
import org.springframework.batch.core.JobParametersBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.stream.Collectors;

@Slf4j
@Service
public class CrawlControlService {
    private final JobLauncher jobLauncher;
    private final Job crawlJob;
    private final CrawlStatusTracker tracker;
    private final CrawlProperties crawlProperties;

    public CrawlControlService(@Qualifier("crawlJobLauncher") JobLauncher jobLauncher,
                               Job crawlJob,
                               CrawlStatusTracker tracker,
                               CrawlProperties crawlProperties) {
        this.jobLauncher = jobLauncher;
        this.crawlJob = crawlJob;
        this.tracker = tracker;
        this.crawlProperties = crawlProperties;
    }

    public List<StoreDescriptor> listStores() {
        return List.copyOf(crawlProperties.getStores());
    }

    public CrawlStatusView status() {
        return tracker.status();
    }

    public CrawlStartResponse startCrawl(String storeId) {
        if (storeId == null || storeId.isBlank()) {
            throw new IllegalArgumentException("store_id is required");
        }
        StoreDescriptor store = crawlProperties.findStore(storeId.trim())
                .orElseThrow(() -> new IllegalArgumentException("Unknown store: " + storeId));
        launch(List.of(store));
        return new CrawlStartResponse(CrawlStartResponse.STARTED, store.id(), "Scraping " + store.name());
    }

    /**
     * Crawls every configured store in order. Returns false without side
     * effects when a crawl is already running.
     */
    public boolean startSweep() {
        List<StoreDescriptor> stores = crawlProperties.getStores();
        if (stores.isEmpty()) {
            log.warn("No stores configured, nothing to crawl");
            return false;
        }
        try {
            launch(stores);
            return true;
        } catch (CrawlBusyException ex) {
            return false;
        }
    }

    private void launch(List<StoreDescriptor> stores) {
        String names = stores.stream().map(StoreDescriptor::name).collect(Collectors.joining(", "));
        if (!tracker.tryStart(stores.get(0).name(), "Starting crawl of " + names)) {
            CrawlStatusView current = tracker.status();
            log.warn("Rejected crawl of {}: already scraping {}", names, current.currentStore());
            throw new CrawlBusyException(current);
        }

        JobParameters params = new JobParametersBuilder()
                .addString(StoreCrawlTasklet.STORE_IDS_PARAM,
                        stores.stream().map(StoreDescriptor::id).collect(Collectors.joining(",")))
                .addLong("startedAt", System.currentTimeMillis())
                .toJobParameters();
        try {
            JobExecution execution = jobLauncher.run(crawlJob, params);
            log.info("Launched crawl of {} (executionId={})", names, execution.getId());
        } catch (JobExecutionException ex) {
            tracker.fail("Could not launch crawl: " + ex.getMessage());
            throw new IllegalStateException("Could not launch crawl of " + names, ex);
        } catch (RuntimeException ex) {
            tracker.fail("Could not launch crawl: " + ex.getMessage());
            throw ex;
        }
    }
}
