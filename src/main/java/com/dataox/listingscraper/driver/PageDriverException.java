package com.dataox.listingscraper.driver;

public class PageDriverException extends RuntimeException {

    public PageDriverException(String message) {
        super(message);
    }

    public PageDriverException(String message, Throwable cause) {
        super(message, cause);
    }
}
