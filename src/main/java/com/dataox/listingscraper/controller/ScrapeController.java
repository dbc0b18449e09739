package com.dataox.listingscraper.controller;

import com.dataox.listingscraper.controller.dto.Health;
import com.dataox.listingscraper.controller.dto.JobList;
import com.dataox.listingscraper.controller.dto.JobProgressView;
import com.dataox.listingscraper.controller.dto.JobResultView;
import com.dataox.listingscraper.controller.dto.JobSummary;
import com.dataox.listingscraper.controller.dto.ScrapeAccepted;
import com.dataox.listingscraper.controller.dto.ScrapeRequest;
import com.dataox.listingscraper.model.ScrapeJob;
import com.dataox.listingscraper.service.ScrapeJobService;
import lombok.RequiredArgsConstructor;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

import java.time.Clock;
import java.time.Instant;

@RestController
@RequiredArgsConstructor
public class ScrapeController {

    private final ScrapeJobService jobService;
    private final Clock clock;

    /**
     * Starts a scrape and returns the job id immediately.
     *
     * POST /scrape {"originUrl": "https://...", "limit_pages": 3}
     */
    @PostMapping("/scrape")
    public ResponseEntity<ScrapeAccepted> scrape(@RequestBody(required = false) ScrapeRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("Missing originUrl");
        }
        ScrapeJob job = jobService.submit(request.originUrl(), request.limitPages());
        return ResponseEntity.accepted().body(ScrapeAccepted.of(job.id()));
    }

    /**
     * Progress while the job runs, results and error once it is finished.
     */
    @GetMapping("/job/{jobId}")
    public ResponseEntity<?> job(@PathVariable String jobId) {
        ScrapeJob job = jobService.find(jobId);
        if (!job.status().isTerminal()) {
            return ResponseEntity.ok(JobProgressView.from(job));
        }
        return ResponseEntity.ok(JobResultView.from(job));
    }

    @GetMapping("/jobs")
    public JobList jobs() {
        return new JobList(jobService.findAll().stream().map(JobSummary::from).toList());
    }

    @GetMapping("/health")
    public Health health() {
        return new Health("ok", Instant.now(clock));
    }
}
