package com.dataox.listingscraper.controller.dto;

public record ScrapeAccepted(
        boolean success,
        String message,
        String jobId,
        String checkStatusUrl,
        String tip
) {

    public static ScrapeAccepted of(String jobId) {
        String statusUrl = "/job/" + jobId;
        return new ScrapeAccepted(true, "Scraping job started", jobId, statusUrl,
                "Poll GET " + statusUrl + " to check progress");
    }
}
