package com.dataox.listingscraper.service;

public class ScrapeInterruptedException extends RuntimeException {

    public ScrapeInterruptedException(String message, InterruptedException cause) {
        super(message, cause);
    }
}
