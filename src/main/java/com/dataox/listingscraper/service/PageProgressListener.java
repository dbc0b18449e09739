package com.dataox.listingscraper.service;

@FunctionalInterface
public interface PageProgressListener {

    PageProgressListener NONE = (page, totalPages) -> { };

    /**
     * Called once a page has been extracted.
     *
     * @param page       1-based page just finished
     * @param totalPages the requested page limit, not the number of pages that exist
     */
    void pageDone(int page, int totalPages);
}
