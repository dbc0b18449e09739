package com.dataox.listingscraper.driver;

@FunctionalInterface
public interface PageDriverFactory {

    /**
     * Starts a new browser session. The caller owns it and must close it.
     *
     * @throws PageDriverException if no session could be started
     */
    PageDriver open();
}
