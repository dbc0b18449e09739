package com.dataox.listingscraper.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "scraper")
@Data
public class ScraperProperties {

    private Browser browser = new Browser();
    private Pagination pagination = new Pagination();

    @Data
    public static class Browser {
        /** Navigation timeout; exceeding it fails the job. */
        private Duration pageLoadTimeout = Duration.ofSeconds(60);
        private Duration scriptTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Pagination {
        private int defaultPages = 1;
        /** How long to wait for the first anchor before extracting anyway. */
        private Duration probeTimeout = Duration.ofSeconds(5);
        private Duration settleDelay = Duration.ofMillis(2000);
        private Duration nextPageDelay = Duration.ofMillis(1500);
        private String probeSelector = "a";
        private String nextPageLabel = "»";
    }
}
