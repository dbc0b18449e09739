package com.dataox.listingscraper.service;

import com.dataox.listingscraper.driver.PageDriver;
import com.dataox.listingscraper.driver.PageDriverFactory;
import com.dataox.listingscraper.model.ListingRecord;
import com.dataox.listingscraper.model.ScrapeJob;
import com.dataox.listingscraper.repository.JobStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;

/**
 * Executes one scrape job from start to a terminal state.
 *
 * <p>Lifecycle: queued, running, then completed or failed. There is a single attempt; a failed
 * job stays failed. The runner only knows the job id and writes every change through
 * {@link JobStore#update}, so pollers always see a consistent snapshot.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScrapeJobRunner {

    private final JobStore jobStore;
    private final PageDriverFactory driverFactory;
    private final Paginator paginator;
    private final ListingDeduplicator deduplicator;
    private final Clock clock;

    public void run(String jobId, String originUrl, int maxPages) {
        log.info("Job {}: starting scrape of {} ({} page(s))", jobId, originUrl, maxPages);
        jobStore.update(jobId, ScrapeJob::running);

        PageDriver driver;
        try {
            driver = driverFactory.open();
        } catch (RuntimeException | Error e) {
            log.error("Job {}: could not start browser session: {}", jobId, e.getMessage(), e);
            fail(jobId, e);
            rethrowIfFatal(e);
            return;
        }

        try {
            List<ListingRecord> raw = paginator.paginate(driver, originUrl, maxPages,
                    (page, total) -> jobStore.update(jobId, job -> job.pageReached(page, total)));

            List<ListingRecord> unique = deduplicator.dedupe(raw);
            jobStore.update(jobId, job -> job.completed(unique, clock.instant()));
            log.info("Job {}: completed with {} listings ({} before dedupe)", jobId, unique.size(), raw.size());
        } catch (RuntimeException | Error e) {
            log.error("Job {}: scrape failed: {}", jobId, e.getMessage(), e);
            fail(jobId, e);
            rethrowIfFatal(e);
        } finally {
            closeQuietly(jobId, driver);
        }
    }

    private void fail(String jobId, Throwable e) {
        jobStore.update(jobId, job -> job.failed(describe(e)));
    }

    // the job is already marked failed, the JVM still has to see these
    private static void rethrowIfFatal(Throwable e) {
        if (e instanceof VirtualMachineError vme) {
            throw vme;
        }
    }

    static String describe(Throwable e) {
        String msg = e.getMessage();
        if (msg == null || msg.isBlank()) {
            return e.getClass().getSimpleName();
        }
        // Selenium appends build and driver info after the first line
        int nl = msg.indexOf('\n');
        return nl > 0 ? msg.substring(0, nl).trim() : msg;
    }

    private void closeQuietly(String jobId, PageDriver driver) {
        try {
            driver.close();
        } catch (RuntimeException | LinkageError e) {
            log.warn("Job {}: failed to close browser session: {}", jobId, e.getMessage());
        }
    }
}
