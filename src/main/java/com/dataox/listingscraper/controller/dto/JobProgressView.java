package com.dataox.listingscraper.controller.dto;

import com.dataox.listingscraper.model.JobStatus;
import com.dataox.listingscraper.model.ScrapeJob;

/**
 * Poll response while a job is queued or running. Results are not exposed yet.
 */
public record JobProgressView(
        String jobId,
        JobStatus status,
        int progress,
        Integer currentPage,
        Integer totalPages
) {

    public static JobProgressView from(ScrapeJob job) {
        return new JobProgressView(job.id(), job.status(), job.progress(), job.currentPage(), job.totalPages());
    }
}
