package com.dataox.listingscraper;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

@SpringBootApplication
public class ListingScraperApplication {

    public static void main(String[] args) {
        SpringApplication.run(ListingScraperApplication.class, args);
    }
}
