package com.scholary.songscraper.api;

import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.session.SessionManager;
import com.scholary.songscraper.session.SessionSnapshot;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import java.util.List;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

/** REST API for building a song list one field at a time. */
@RestController
@RequestMapping("/api/users/{userId}/session")
@Tag(name = "Song sessions", description = "Interactive song-list builder")
public class SessionController {

  private final SessionManager sessionManager;

  public SessionController(SessionManager sessionManager) {
    this.sessionManager = sessionManager;
  }

  @PostMapping
  @Operation(summary = "Start adding a song")
  public ResponseEntity<SessionSnapshot> start(@PathVariable long userId) {
    return ResponseEntity.status(HttpStatus.CREATED).body(sessionManager.start(userId));
  }

  @GetMapping
  @Operation(summary = "Current session state")
  public ResponseEntity<SessionSnapshot> get(@PathVariable long userId) {
    return ResponseEntity.ok(sessionManager.snapshot(userId));
  }

  @PostMapping("/field")
  @Operation(
      summary = "Submit the expected field",
      description = "Title, artist, URL in turn; while awaiting confirmation, the event label.")
  public ResponseEntity<SessionSnapshot> submitField(
      @PathVariable long userId, @RequestBody SessionFieldRequest request) {
    return ResponseEntity.ok(sessionManager.submitField(userId, request.value()));
  }

  @PostMapping("/confirm")
  @Operation(summary = "Queue the drafted song")
  public ResponseEntity<SessionSnapshot> confirm(@PathVariable long userId) {
    return ResponseEntity.ok(sessionManager.confirm(userId));
  }

  @PostMapping("/finish")
  @Operation(summary = "Stop adding songs")
  public ResponseEntity<SessionSnapshot> finish(@PathVariable long userId) {
    return ResponseEntity.ok(sessionManager.finish(userId));
  }

  @PostMapping("/cancel")
  @Operation(summary = "Drop the drafted song", description = "The queue is kept.")
  public ResponseEntity<SessionSnapshot> cancel(@PathVariable long userId) {
    return ResponseEntity.ok(sessionManager.cancel(userId));
  }

  @GetMapping("/queue")
  @Operation(summary = "Queued songs")
  public ResponseEntity<List<SongRequest>> queue(@PathVariable long userId) {
    return ResponseEntity.ok(sessionManager.queue(userId));
  }

  @DeleteMapping("/queue")
  @Operation(summary = "Clear the queue")
  public ResponseEntity<Void> clear(@PathVariable long userId) {
    sessionManager.clear(userId);
    return ResponseEntity.noContent().build();
  }

  @PostMapping("/queue/submit")
  @Operation(summary = "Submit the queue as a scrape job")
  public ResponseEntity<AsyncJobResponse> submitQueue(@PathVariable long userId) {
    String jobId = sessionManager.submitQueue(userId);
    return ResponseEntity.status(HttpStatus.ACCEPTED)
        .body(new AsyncJobResponse(jobId, "/api/jobs/" + jobId));
  }
}
