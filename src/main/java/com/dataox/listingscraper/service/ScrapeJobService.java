package com.dataox.listingscraper.service;

import com.dataox.listingscraper.config.ExecutorConfig;
import com.dataox.listingscraper.config.ScraperProperties;
import com.dataox.listingscraper.model.ScrapeJob;
import com.dataox.listingscraper.repository.JobStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.core.task.TaskExecutor;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.security.SecureRandom;
import java.time.Clock;
import java.util.List;
import java.util.Random;

@Service
@Slf4j
public class ScrapeJobService {

    private static final String ID_ALPHABET = "0123456789abcdefghijklmnopqrstuvwxyz";
    private static final int ID_SUFFIX_LENGTH = 9;

    private final JobStore jobStore;
    private final ScrapeJobRunner runner;
    private final TaskExecutor executor;
    private final ScraperProperties properties;
    private final Clock clock;
    private final Random random = new SecureRandom();

    public ScrapeJobService(JobStore jobStore,
                            ScrapeJobRunner runner,
                            @Qualifier(ExecutorConfig.SCRAPE_EXECUTOR) TaskExecutor executor,
                            ScraperProperties properties,
                            Clock clock) {
        this.jobStore = jobStore;
        this.runner = runner;
        this.executor = executor;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Registers a queued job and starts it in the background. Returns without waiting for the scrape.
     *
     * @throws IllegalArgumentException if {@code originUrl} is missing
     */
    public ScrapeJob submit(String originUrl, Integer limitPages) {
        if (originUrl == null || originUrl.isBlank()) {
            throw new IllegalArgumentException("Missing originUrl");
        }
        String url = originUrl.trim();
        int maxPages = limitPages == null || limitPages < 1
                ? Math.max(1, properties.getPagination().getDefaultPages())
                : limitPages;

        ScrapeJob job;
        do {
            job = ScrapeJob.queued(newJobId(), url, clock.instant());
        } while (!jobStore.create(job));

        String jobId = job.id();
        try {
            executor.execute(() -> runner.run(jobId, url, maxPages));
        } catch (TaskRejectedException e) {
            log.error("Job {}: executor rejected the scrape: {}", jobId, e.getMessage());
            jobStore.update(jobId, j -> j.failed("Scrape could not be scheduled: " + e.getMessage()));
        }
        log.info("Job {}: queued for {} ({} page(s))", jobId, url, maxPages);
        return job;
    }

    public ScrapeJob find(String jobId) {
        return jobStore.find(jobId).orElseThrow(() -> new JobNotFoundException(jobId));
    }

    public List<ScrapeJob> findAll() {
        return jobStore.findAll();
    }

    String newJobId() {
        StringBuilder sb = new StringBuilder("job_").append(clock.millis()).append('_');
        for (int i = 0; i < ID_SUFFIX_LENGTH; i++) {
            sb.append(ID_ALPHABET.charAt(random.nextInt(ID_ALPHABET.length())));
        }
        return sb.toString();
    }
}
