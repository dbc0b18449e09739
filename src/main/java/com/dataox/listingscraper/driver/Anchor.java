package com.dataox.listingscraper.driver;

/**
 * Snapshot of one rendered {@code <a>} element.
 *
 * @param text        visible text of the anchor (innerText)
 * @param headingText visible text of the first nested h3/h4, or null
 * @param href        resolved absolute URL
 */
public record Anchor(String text, String headingText, String href) {
}
