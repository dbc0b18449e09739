package com.dataox.listingscraper.repository;

import com.dataox.listingscraper.model.ScrapeJob;
import org.springframework.stereotype.Repository;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Process-wide in-memory store of scrape jobs, keyed by job id.
 *
 * <p>All access goes through this object's monitor, so each update is an atomic replace of one
 * snapshot. Jobs are kept in submission order and never evicted; everything is lost on restart.
 */
@Repository
public class JobStore {

    private final Map<String, ScrapeJob> jobs = new LinkedHashMap<>();

    /**
     * @return false when a job with the same id already exists (nothing is stored in that case)
     */
    public synchronized boolean create(ScrapeJob job) {
        Objects.requireNonNull(job, "job");
        if (jobs.containsKey(job.id())) {
            return false;
        }
        jobs.put(job.id(), job);
        return true;
    }

    public synchronized Optional<ScrapeJob> find(String id) {
        return Optional.ofNullable(jobs.get(id));
    }

    /**
     * Replaces the job with the result of {@code change}. Exceptions thrown by {@code change}
     * propagate and leave the stored snapshot untouched.
     *
     * @return the new snapshot, or empty if the id is unknown
     */
    public synchronized Optional<ScrapeJob> update(String id, UnaryOperator<ScrapeJob> change) {
        ScrapeJob current = jobs.get(id);
        if (current == null) {
            return Optional.empty();
        }
        ScrapeJob next = Objects.requireNonNull(change.apply(current), "updated job");
        jobs.put(id, next);
        return Optional.of(next);
    }

    public synchronized List<ScrapeJob> findAll() {
        return new ArrayList<>(jobs.values());
    }
}
