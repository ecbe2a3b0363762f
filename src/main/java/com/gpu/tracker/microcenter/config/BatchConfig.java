package com.gpu.tracker.microcenter.config;

import com.gpu.tracker.microcenter.batch.CrawlJobListener;
import com.gpu.tracker.microcenter.batch.ListingExtractor;
import com.gpu.tracker.microcenter.batch.PageFetcher;
import com.gpu.tracker.microcenter.batch.PageIngestor;
import com.gpu.tracker.microcenter.batch.StoreCrawlTasklet;
import com.gpu.tracker.microcenter.model.StoreDescriptor;
import com.gpu.tracker.microcenter.service.CrawlStatusTracker;
import com.gpu.tracker.microcenter.service.Pacer;
import org.springframework.batch.core.Job;
import org.springframework.batch.core.Step;
import org.springframework.batch.core.configuration.annotation.StepScope;
import org.springframework.batch.core.job.builder.JobBuilder;
import org.springframework.batch.core.launch.JobLauncher;
import org.springframework.batch.core.launch.support.TaskExecutorJobLauncher;
import org.springframework.batch.core.repository.JobRepository;
import org.springframework.batch.core.step.builder.StepBuilder;
import org.springframework.batch.support.transaction.ResourcelessTransactionManager;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;

import java.util.Arrays;
import java.util.List;

@Configuration
public class BatchConfig {
    public static final String CRAWL_JOB_NAME = "microcenterCrawlJob";

    @Bean
    public Job crawlJob(JobRepository jobRepository, Step crawlStep, CrawlJobListener crawlJobListener) {
        return new JobBuilder(CRAWL_JOB_NAME, jobRepository)
                .listener(crawlJobListener)
                .start(crawlStep)
                .build();
    }

    @Bean
    public Step crawlStep(JobRepository jobRepository, StoreCrawlTasklet storeCrawlTasklet) {
        // no chunk transaction: PageIngestor commits each page on its own
        return new StepBuilder("crawlStep", jobRepository)
                .tasklet(storeCrawlTasklet, new ResourcelessTransactionManager())
                .build();
    }

    @Bean
    @StepScope
    public StoreCrawlTasklet storeCrawlTasklet(@Value("#{jobParameters['storeIds']}") String storeIds,
                                               PageFetcher pageFetcher,
                                               ListingExtractor listingExtractor,
                                               PageIngestor pageIngestor,
                                               CrawlStatusTracker crawlStatusTracker,
                                               Pacer pacer,
                                               CrawlProperties crawlProperties) {
        List<StoreDescriptor> stores = Arrays.stream(storeIds == null ? new String[0] : storeIds.split(","))
                .map(String::trim)
                .filter(id -> !id.isEmpty())
                .map(id -> crawlProperties.findStore(id)
                        .orElseThrow(() -> new IllegalArgumentException("Unknown store: " + id)))
                .toList();
        return new StoreCrawlTasklet(stores, pageFetcher, listingExtractor, pageIngestor,
                crawlStatusTracker, pacer, crawlProperties);
    }

    @Bean
    public TaskExecutor crawlTaskExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(1);
        executor.setMaxPoolSize(1);
        executor.setThreadNamePrefix("crawl-worker-");
        return executor;
    }

    @Bean
    public JobLauncher crawlJobLauncher(JobRepository jobRepository, TaskExecutor crawlTaskExecutor) throws Exception {
        TaskExecutorJobLauncher launcher = new TaskExecutorJobLauncher();
        launcher.setJobRepository(jobRepository);
        launcher.setTaskExecutor(crawlTaskExecutor);
        launcher.afterPropertiesSet();
        return launcher;
    }
}
