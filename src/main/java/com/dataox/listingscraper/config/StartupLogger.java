package com.dataox.listingscraper.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.web.context.WebServerInitializedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

@Component
@Slf4j
public class StartupLogger {

    @EventListener
    public void onWebServerReady(WebServerInitializedEvent event) {
        log.info("Scraper API listening on port {}", event.getWebServer().getPort());
        log.info("Endpoints: POST /scrape | GET /job/:jobId | GET /jobs | GET /health");
    }
}
