package com.dataox.listingscraper.model;

/**
 * One listing pulled out of a result page.
 *
 * @param title best-effort title, heading text or the first line of the anchor text
 * @param price price token with thousands separators, e.g. {@code 300,000}
 * @param area  square-meter value, or {@link #AREA_NOT_AVAILABLE}
 * @param link  absolute URL of the listing, used as its identity
 */
public record ListingRecord(String title, String price, String area, String link) {

    public static final String AREA_NOT_AVAILABLE = "N/A";
}
