package com.dataox.listingscraper.controller.dto;

import java.time.Instant;

public record Health(String status, Instant timestamp) {
}
