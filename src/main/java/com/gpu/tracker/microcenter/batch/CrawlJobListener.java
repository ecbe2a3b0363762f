package com.gpu.tracker.microcenter.batch;

import com.gpu.tracker.microcenter.service.CrawlStatusTracker;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.batch.core.BatchStatus;
import org.springframework.batch.core.JobExecution;
import org.springframework.batch.core.JobExecutionListener;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

/**
 * Returns the crawl tracker to a non-running phase whenever a crawl job ends.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class CrawlJobListener implements JobExecutionListener {
    private final CrawlStatusTracker tracker;

    @Override
    public void beforeJob(JobExecution jobExecution) {
        log.info("Crawl job {} started with {}", jobExecution.getId(), jobExecution.getJobParameters());
    }

    @Override
    public void afterJob(JobExecution jobExecution) {
        if (jobExecution.getStatus() == BatchStatus.COMPLETED) {
            tracker.complete();
            log.info("Crawl job {} completed: {}", jobExecution.getId(), tracker.status().message());
            return;
        }
        String failures = jobExecution.getAllFailureExceptions().stream()
                .map(Throwable::getMessage)
                .collect(Collectors.joining("; "));
        String message = "Crawl " + jobExecution.getStatus().name().toLowerCase()
                + (failures.isBlank() ? "" : ": " + failures);
        tracker.fail(message);
        log.error("Crawl job {} ended with status {}: {}", jobExecution.getId(), jobExecution.getStatus(), failures);
    }
}
