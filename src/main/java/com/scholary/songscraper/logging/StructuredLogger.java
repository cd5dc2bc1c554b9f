package com.scholary.songscraper.logging;

import org.slf4j.Logger;
import org.slf4j.MDC;

/**
 * Utility for structured logging with MDC (Mapped Diagnostic Context).
 *
 * <p>Each method puts the event's fields into the MDC for the duration of one log call, so log
 * shippers can index them as fields instead of parsing the message.
 */
public class StructuredLogger {

  private final Logger logger;

  public StructuredLogger(Logger logger) {
    this.logger = logger;
  }

  /** Log song task started event. */
  public void logSongStarted(String jobId, String title, String url) {
    try {
      MDC.put("event_type", "song_started");
      MDC.put("songTitle", title);

      logger.debug("Song started: jobId={}, title={}, url={}", jobId, title, url);
    } finally {
      clearEventFields();
    }
  }

  /** Log song task finished event. */
  public void logSongFinished(
      String jobId, String title, boolean hasLyrics, boolean hasAudio, long elapsedMs) {
    try {
      MDC.put("event_type", "song_finished");
      MDC.put("songTitle", title);
      MDC.put("hasLyrics", String.valueOf(hasLyrics));
      MDC.put("hasAudio", String.valueOf(hasAudio));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Song finished: jobId={}, title={}, lyrics={}, audio={}, elapsed={}ms",
          jobId,
          title,
          hasLyrics,
          hasAudio,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Log song skipped because its job was cancelled. */
  public void logSongSkipped(String jobId, String title) {
    try {
      MDC.put("event_type", "song_skipped");
      MDC.put("songTitle", title);

      logger.info("Song skipped, job cancelled: jobId={}, title={}", jobId, title);
    } finally {
      clearEventFields();
    }
  }

  /** Log a single artifact that could not be fetched or stored. */
  public void logArtifactFailed(String jobId, String title, String phase, String reason) {
    try {
      MDC.put("event_type", "artifact_failed");
      MDC.put("songTitle", title);
      MDC.put("phase", phase);
      MDC.put("errorType", reason);

      logger.warn(
          "Artifact failed: jobId={}, title={}, phase={}, reason={}", jobId, title, phase, reason);
    } finally {
      clearEventFields();
    }
  }

  /** Log job progress event. */
  public void logJobProgress(
      String jobId, String phase, int processed, int total, double percentComplete) {
    try {
      MDC.put("event_type", "job_progress");
      MDC.put("phase", phase);
      MDC.put("processed", String.valueOf(processed));
      MDC.put("total", String.valueOf(total));
      MDC.put("percentComplete", String.valueOf(percentComplete));

      logger.info(
          "Job progress: jobId={}, phase={}, items={}/{}, progress={}%",
          jobId,
          phase,
          processed,
          total,
          percentComplete);
    } finally {
      clearEventFields();
    }
  }

  /** Log job state transition. */
  public void logJobTransition(String jobId, String from, String to) {
    try {
      MDC.put("event_type", "job_transition");
      MDC.put("fromState", from);
      MDC.put("toState", to);

      logger.info("Job transition: jobId={}, {} -> {}", jobId, from, to);
    } finally {
      clearEventFields();
    }
  }

  /** Log job finished event. */
  public void logJobFinished(
      String jobId, String state, int total, int completed, int failed, String error) {
    try {
      MDC.put("event_type", "job_finished");
      MDC.put("toState", state);
      MDC.put("total", String.valueOf(total));
      MDC.put("completed", String.valueOf(completed));
      MDC.put("failed", String.valueOf(failed));

      if (error == null) {
        logger.info(
            "Job finished: jobId={}, state={}, songs={}/{}, failed={}",
            jobId,
            state,
            completed,
            total,
            failed);
      } else {
        logger.warn(
            "Job finished: jobId={}, state={}, songs={}/{}, failed={}, error={}",
            jobId,
            state,
            completed,
            total,
            failed,
            error);
      }
    } finally {
      clearEventFields();
    }
  }

  /** Log expired blob deletion. */
  public void logBlobDeleted(String key, String artifactType, long sizeBytes, long ageSeconds) {
    try {
      MDC.put("event_type", "blob_deleted");
      MDC.put("blobKey", key);
      MDC.put("artifactType", artifactType);
      MDC.put("sizeBytes", String.valueOf(sizeBytes));
      MDC.put("ageSeconds", String.valueOf(ageSeconds));

      logger.info(
          "Blob deleted: key={}, type={}, size={} bytes, age={}s",
          key,
          artifactType,
          sizeBytes,
          ageSeconds);
    } finally {
      clearEventFields();
    }
  }

  /** Log sweep summary. */
  public void logSweepFinished(int scanned, int deleted, int errors, long elapsedMs) {
    try {
      MDC.put("event_type", "sweep_finished");
      MDC.put("scanned", String.valueOf(scanned));
      MDC.put("deleted", String.valueOf(deleted));
      MDC.put("errors", String.valueOf(errors));
      MDC.put("elapsedMs", String.valueOf(elapsedMs));

      logger.info(
          "Sweep finished: scanned={}, deleted={}, errors={}, elapsed={}ms",
          scanned,
          deleted,
          errors,
          elapsedMs);
    } finally {
      clearEventFields();
    }
  }

  /** Set job context in MDC. */
  public static void setJobContext(String jobId, long userId) {
    MDC.put("jobId", jobId);
    MDC.put("userId", String.valueOf(userId));
  }

  /** Clear job context from MDC. */
  public static void clearJobContext() {
    MDC.remove("jobId");
    MDC.remove("userId");
  }

  /** Clear event-specific fields from MDC. Job context keys are left alone. */
  private void clearEventFields() {
    MDC.remove("event_type");
    MDC.remove("songTitle");
    MDC.remove("hasLyrics");
    MDC.remove("hasAudio");
    MDC.remove("elapsedMs");
    MDC.remove("phase");
    MDC.remove("errorType");
    MDC.remove("processed");
    MDC.remove("total");
    MDC.remove("percentComplete");
    MDC.remove("fromState");
    MDC.remove("toState");
    MDC.remove("completed");
    MDC.remove("failed");
    MDC.remove("blobKey");
    MDC.remove("artifactType");
    MDC.remove("sizeBytes");
    MDC.remove("ageSeconds");
    MDC.remove("scanned");
    MDC.remove("deleted");
    MDC.remove("errors");
  }
}
