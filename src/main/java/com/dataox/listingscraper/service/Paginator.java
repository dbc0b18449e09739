package com.dataox.listingscraper.service;

import com.dataox.listingscraper.config.ScraperProperties;
import com.dataox.listingscraper.driver.PageControl;
import com.dataox.listingscraper.driver.PageDriver;
import com.dataox.listingscraper.model.ListingRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Walks a paginated result list with one browser session.
 *
 * <p>The start URL is opened once; further pages are reached by clicking the "next" control.
 * Running out of "next" controls before {@code maxPages} ends the walk normally.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class Paginator {

    private final ScraperProperties properties;
    private final ListingExtractor extractor;
    private final Sleeper sleeper;

    /**
     * @return every listing seen on every visited page, in page order, duplicates included
     */
    public List<ListingRecord> paginate(PageDriver driver, String startUrl, int maxPages,
                                        PageProgressListener listener) {
        ScraperProperties.Pagination cfg = properties.getPagination();
        List<ListingRecord> all = new ArrayList<>();

        driver.navigate(startUrl);

        for (int page = 1; page <= maxPages; page++) {
            log.debug("Scraping page {}/{} of {}", page, maxPages, startUrl);

            if (!driver.waitFor(cfg.getProbeSelector(), cfg.getProbeTimeout())) {
                log.info("No '{}' element within {} on page {}, extracting anyway",
                        cfg.getProbeSelector(), cfg.getProbeTimeout(), page);
            }
            pause(cfg.getSettleDelay());

            List<ListingRecord> found = extractor.extract(driver.readAnchors());
            all.addAll(found);
            log.debug("Page {} yielded {} listings", page, found.size());

            listener.pageDone(page, maxPages);

            if (page < maxPages) {
                Optional<PageControl> next = driver.findControl(cfg.getNextPageLabel());
                if (next.isEmpty()) {
                    log.info("No more pages after page {} of {}", page, startUrl);
                    break;
                }
                driver.activate(next.get());
                pause(cfg.getNextPageDelay());
            }
        }
        return all;
    }

    private void pause(Duration d) {
        if (d == null || d.isZero() || d.isNegative()) return;
        try {
            sleeper.sleep(d);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new ScrapeInterruptedException("Scrape interrupted while waiting for the page", e);
        }
    }
}
