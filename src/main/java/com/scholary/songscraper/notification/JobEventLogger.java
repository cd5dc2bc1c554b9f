package com.scholary.songscraper.notification;

import com.scholary.songscraper.logging.StructuredLogger;
import com.scholary.songscraper.progress.PhaseProgressView;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/** Writes job notifications to the structured log. */
@Component
public class JobEventLogger {

  private final StructuredLogger structuredLogger =
      new StructuredLogger(LoggerFactory.getLogger(JobEventLogger.class));

  @EventListener
  public void onStateChanged(JobStateChangedEvent event) {
    structuredLogger.logJobTransition(
        event.jobId(), String.valueOf(event.from()), String.valueOf(event.to()));
  }

  @EventListener
  public void onPhaseProgress(PhaseProgressEvent event) {
    PhaseProgressView progress = event.progress();
    structuredLogger.logJobProgress(
        event.jobId(),
        progress.phase().name(),
        progress.current(),
        progress.total(),
        progress.percentage());
  }

  @EventListener
  public void onJobFinished(JobFinishedEvent event) {
    structuredLogger.logJobFinished(
        event.jobId(),
        event.state().name(),
        event.totalSongs(),
        event.completedSongs(),
        event.failedSongs(),
        event.errorMessage());
  }
}
