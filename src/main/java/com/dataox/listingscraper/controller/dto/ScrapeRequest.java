package com.dataox.listingscraper.controller.dto;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonIgnoreProperties(ignoreUnknown = true)
public record ScrapeRequest(
        String originUrl,
        @JsonProperty("limit_pages") Integer limitPages
) {
}
