package com.dataox.listingscraper.controller.dto;

import java.util.List;

public record JobList(List<JobSummary> jobs) {
}
