package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.config.CrawlProperties;
import com.gpu.tracker.microcenter.model.PageResult;
import com.gpu.tracker.microcenter.model.RawListing;
import com.gpu.tracker.microcenter.model.StoreDescriptor;
import com.gpu.tracker.microcenter.service.CrawlStatusTracker;
import com.gpu.tracker.microcenter.service.Pacer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.StepContribution;
import org.springframework.batch.core.scope.context.ChunkContext;
import org.springframework.batch.core.step.tasklet.Tasklet;
import org.springframework.batch.repeat.RepeatStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * Crawls the listing pages of one or more stores, one page per invocation.
 * A store is finished once a page records fewer items than a full page, the
 * page limit is reached, or a page fails; the next store then starts at page 1
 * after the inter-store delay.
 */
@Slf4j
public class StoreCrawlTasklet implements Tasklet {
    public static final String STORE_IDS_PARAM = "storeIds";

    private final List<StoreDescriptor> stores;
    private final PageFetcher fetcher;
    private final ListingExtractor extractor;
    private final PageIngestor ingestor;
    private final CrawlStatusTracker tracker;
    private final Pacer pacer;
    private final CrawlProperties properties;

    private final List<String> storeSummaries = new ArrayList<>();
    private int storeIndex = 0;
    private int pageNumber = 1;
    private int storePages = 0;
    private int storeItems = 0;

    public StoreCrawlTasklet(List<StoreDescriptor> stores,
                             PageFetcher fetcher,
                             ListingExtractor extractor,
                             PageIngestor ingestor,
                             CrawlStatusTracker tracker,
                             Pacer pacer,
                             CrawlProperties properties) {
        this.stores = List.copyOf(stores);
        this.fetcher = fetcher;
        this.extractor = extractor;
        this.ingestor = ingestor;
        this.tracker = tracker;
        this.pacer = pacer;
        this.properties = properties;
    }

    @Override
    public RepeatStatus execute(StepContribution contribution, ChunkContext chunkContext) throws Exception {
        if (storeIndex >= stores.size()) {
            tracker.progress(null, "No stores to crawl");
            return RepeatStatus.FINISHED;
        }
        StoreDescriptor store = stores.get(storeIndex);
        if (pageNumber > 1) {
            pacer.pause(properties.getPageDelayMs());
        } else if (storeIndex > 0) {
            pacer.pause(properties.getStoreDelayMs());
        }

        String url = properties.pageUrl(store.id(), pageNumber);
        tracker.progress(store.name(), "Scraping page " + pageNumber + " for " + store.name());
        log.info("Scraping page {} for {}: {}", pageNumber, store.name(), url);

        PageResult result;
        try {
            String html = fetcher.fetch(url);
            List<RawListing> listings = extractor.extract(html, properties.getSiteBaseUrl());
            result = ingestor.ingest(store, listings);
        } catch (PageFetchException ex) {
            log.warn("Stopping {} at page {}: {}", store.name(), pageNumber, ex.getMessage());
            return finishStore(store, "stopped at page " + pageNumber + " (" + ex.getMessage() + ")");
        } catch (RuntimeException ex) {
            log.error("Page {} for {} failed and was rolled back", pageNumber, store.name(), ex);
            return finishStore(store, "page " + pageNumber + " failed (" + ex.getMessage() + ")");
        }

        storePages++;
        storeItems += result.itemsRecorded();
        contribution.incrementWriteCount(result.itemsRecorded());
        tracker.pageCompleted(result.itemsRecorded());
        log.info("Recorded {} of {} items on page {} for {}",
                result.itemsRecorded(), result.itemsFound(), pageNumber, store.name());

        if (result.itemsRecorded() < properties.getPageSize()) {
            return finishStore(store, "last page was " + pageNumber);
        }
        if (pageNumber >= properties.getMaxPages()) {
            log.warn("Reached page limit of {} for {}", properties.getMaxPages(), store.name());
            return finishStore(store, "page limit " + properties.getMaxPages() + " reached");
        }
        pageNumber++;
        return RepeatStatus.CONTINUABLE;
    }

    private RepeatStatus finishStore(StoreDescriptor store, String reason) {
        String summary = store.name() + ": " + storeItems + " items from " + storePages + " pages, " + reason;
        storeSummaries.add(summary);
        log.info("Finished {}", summary);

        storeIndex++;
        pageNumber = 1;
        storePages = 0;
        storeItems = 0;

        if (storeIndex < stores.size()) {
            tracker.progress(stores.get(storeIndex).name(), "Finished " + summary);
            return RepeatStatus.CONTINUABLE;
        }
        tracker.progress(null, "Finished " + String.join("; ", storeSummaries));
        return RepeatStatus.FINISHED;
    }
}
