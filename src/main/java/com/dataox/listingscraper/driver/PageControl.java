package com.dataox.listingscraper.driver;

/**
 * Handle to a clickable element found by {@link PageDriver#findControl(String)}.
 * Only valid for the driver that returned it.
 */
public interface PageControl {

    String label();
}
