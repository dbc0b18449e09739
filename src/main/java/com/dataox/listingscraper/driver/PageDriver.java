package com.dataox.listingscraper.driver;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

/**
 * A single browser session the scraper can steer.
 *
 * <p>Implementations wrap a concrete automation engine. Failures are reported as unchecked
 * exceptions; the scrape that owns the session decides what they mean.
 */
public interface PageDriver extends AutoCloseable {

    void navigate(String url);

    /**
     * Waits until at least one element matches the CSS selector.
     *
     * @return false if nothing matched within the timeout
     */
    boolean waitFor(String cssSelector, Duration timeout);

    /** Reads every anchor element of the current page. */
    List<Anchor> readAnchors();

    /** Finds the first button whose text or aria-label contains {@code label}, if it is visible. */
    Optional<PageControl> findControl(String label);

    void activate(PageControl control);

    @Override
    void close();
}
