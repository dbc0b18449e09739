package com.dataox.listingscraper.service;

import java.time.Duration;

/**
 * Blocking pause used for settle delays. Swapped for a no-op in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper THREAD = duration -> Thread.sleep(duration.toMillis());

    void sleep(Duration duration) throws InterruptedException;
}
