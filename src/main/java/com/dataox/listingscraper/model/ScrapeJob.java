package com.dataox.listingscraper.model;

import java.time.Instant;
import java.util.List;

/**
 * Immutable snapshot of one scrape job.
 *
 * <p>Every state change returns a new snapshot, so a reader polling the store never sees a
 * half-updated job. Transitions that move backwards throw {@link IllegalStateException}.
 *
 * @param id          opaque job identifier
 * @param originUrl   the URL the scrape starts from
 * @param status      lifecycle status
 * @param progress    0..100, never decreases while running
 * @param currentPage last page reported by the paginator, null before the first page
 * @param totalPages  requested page limit, null before the first page
 * @param results     deduplicated listings, empty until completed
 * @param error       failure message, only set when failed
 * @param createdAt   submission time
 * @param completedAt completion time, only set when completed
 */
public record ScrapeJob(
        String id,
        String originUrl,
        JobStatus status,
        int progress,
        Integer currentPage,
        Integer totalPages,
        List<ListingRecord> results,
        String error,
        Instant createdAt,
        Instant completedAt
) {

    public ScrapeJob {
        results = results == null ? List.of() : List.copyOf(results);
    }

    public static ScrapeJob queued(String id, String originUrl, Instant createdAt) {
        return new ScrapeJob(id, originUrl, JobStatus.QUEUED, 0, null, null, List.of(), null, createdAt, null);
    }

    public ScrapeJob running() {
        requireTransition(JobStatus.RUNNING);
        return new ScrapeJob(id, originUrl, JobStatus.RUNNING, 0, currentPage, totalPages, List.of(), null,
                createdAt, null);
    }

    public ScrapeJob pageReached(int page, int total) {
        if (status != JobStatus.RUNNING) {
            throw new IllegalStateException("Job " + id + " is " + status.wireName() + ", cannot report progress");
        }
        int computed = (int) Math.round((double) page / total * 100);
        int bounded = Math.max(0, Math.min(100, computed));
        return new ScrapeJob(id, originUrl, JobStatus.RUNNING, Math.max(progress, bounded), page, total, List.of(),
                null, createdAt, null);
    }

    public ScrapeJob completed(List<ListingRecord> listings, Instant at) {
        requireTransition(JobStatus.COMPLETED);
        return new ScrapeJob(id, originUrl, JobStatus.COMPLETED, 100, currentPage, totalPages, listings, null,
                createdAt, at);
    }

    public ScrapeJob failed(String message) {
        requireTransition(JobStatus.FAILED);
        return new ScrapeJob(id, originUrl, JobStatus.FAILED, 0, null, null, List.of(), message, createdAt, null);
    }

    public int count() {
        return results.size();
    }

    private void requireTransition(JobStatus next) {
        if (!status.canTransitionTo(next)) {
            throw new IllegalStateException(
                    "Job " + id + " cannot move from " + status.wireName() + " to " + next.wireName());
        }
    }
}
