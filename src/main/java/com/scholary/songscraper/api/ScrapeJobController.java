package com.scholary.songscraper.api;

import com.scholary.songscraper.job.JobState;
import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.service.JobManager;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import java.net.URI;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/**
 * REST API for scrape jobs.
 *
 * <p>Submission only queues the job; clients poll the status endpoint until the job is terminal
 * and then follow the download link.
 */
@RestController
@RequestMapping("/api")
@Tag(name = "Scrape jobs", description = "Submit, track and cancel song scrape jobs")
public class ScrapeJobController {

  private static final Logger LOGGER = LoggerFactory.getLogger(ScrapeJobController.class);

  private final JobManager jobManager;

  public ScrapeJobController(JobManager jobManager) {
    this.jobManager = jobManager;
  }

  @PostMapping("/jobs")
  @Operation(
      summary = "Submit a scrape job",
      description =
          "Queues one job for the songs and returns its id immediately. "
              + "Lyrics and audio are fetched in the background.")
  public ResponseEntity<AsyncJobResponse> submit(@Valid @RequestBody SubmitJobRequest request) {
    List<SongRequest> songs =
        request.songs().stream().map(SongSubmission::toRequest).collect(Collectors.toList());
    String jobId = jobManager.submit(request.userId(), songs);

    LOGGER.info("Job accepted: jobId={}, songs={}", jobId, songs.size());
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }

  @GetMapping("/jobs/{jobId}")
  @Operation(summary = "Get job status", description = "State, counters and per-phase progress")
  public ResponseEntity<JobStatusResponse> status(@PathVariable String jobId) {
    return ResponseEntity.ok(JobStatusResponse.from(jobManager.status(jobId)));
  }

  @PostMapping("/jobs/{jobId}/cancel")
  @Operation(
      summary = "Cancel a job",
      description = "Songs already running finish; the rest are skipped and the job is cancelled.")
  public ResponseEntity<JobStatusResponse> cancel(@PathVariable String jobId) {
    jobManager.cancel(jobId);
    return ResponseEntity.ok(JobStatusResponse.from(jobManager.status(jobId)));
  }

  @GetMapping("/jobs/{jobId}/download")
  @Operation(summary = "Download a job's bundle", description = "Redirects to a time-limited link")
  public ResponseEntity<Void> download(@PathVariable String jobId) {
    URI location = URI.create(jobManager.downloadLink(jobId).toString());
    return ResponseEntity.status(HttpStatus.FOUND).location(location).build();
  }

  @GetMapping("/jobs/stats")
  @Operation(summary = "Job counts per state")
  public ResponseEntity<Map<JobState, Long>> statistics() {
    return ResponseEntity.ok(jobManager.statistics());
  }

  @GetMapping("/users/{userId}/jobs")
  @Operation(summary = "List a user's jobs", description = "Newest first")
  public ResponseEntity<List<JobStatusResponse>> listForUser(@PathVariable long userId) {
    List<JobStatusResponse> jobs =
        jobManager.listForUser(userId).stream()
            .map(job -> JobStatusResponse.from(job, List.of()))
            .collect(Collectors.toList());
    return ResponseEntity.ok(jobs);
  }
}
