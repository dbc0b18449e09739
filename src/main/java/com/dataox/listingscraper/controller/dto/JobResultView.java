package com.dataox.listingscraper.controller.dto;

import com.dataox.listingscraper.model.JobStatus;
import com.dataox.listingscraper.model.ListingRecord;
import com.dataox.listingscraper.model.ScrapeJob;

import java.time.Instant;
import java.util.List;

/**
 * Poll response once a job is completed or failed.
 */
public record JobResultView(
        String jobId,
        JobStatus status,
        int progress,
        int count,
        List<ListingRecord> data,
        String error,
        Instant completedAt
) {

    public static JobResultView from(ScrapeJob job) {
        return new JobResultView(job.id(), job.status(), job.progress(), job.count(), job.results(),
                job.error(), job.completedAt());
    }
}
