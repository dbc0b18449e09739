package com.dataox.listingscraper.controller.dto;

import com.dataox.listingscraper.model.JobStatus;
import com.dataox.listingscraper.model.ScrapeJob;

public record JobSummary(String jobId, JobStatus status, int progress) {

    public static JobSummary from(ScrapeJob job) {
        return new JobSummary(job.id(), job.status(), job.progress());
    }
}
