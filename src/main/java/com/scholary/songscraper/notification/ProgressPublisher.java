package com.scholary.songscraper.notification;

import com.scholary.songscraper.progress.Outcome;
import com.scholary.songscraper.progress.Phase;
import com.scholary.songscraper.progress.PhaseProgressView;
import com.scholary.songscraper.progress.PhaseStatus;
import com.scholary.songscraper.progress.ProgressTracker;
import java.util.Optional;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.stereotype.Component;

/**
 * Applies progress updates to the tracker and announces the accepted ones.
 *
 * <p>Ignored updates (finished or unknown phase) produce no event.
 */
@Component
public class ProgressPublisher {

  private final ProgressTracker tracker;
  private final ApplicationEventPublisher eventPublisher;

  public ProgressPublisher(ProgressTracker tracker, ApplicationEventPublisher eventPublisher) {
    this.tracker = tracker;
    this.eventPublisher = eventPublisher;
  }

  public PhaseProgressView open(String jobId, Phase phase, int total) {
    PhaseProgressView view = tracker.open(jobId, phase, total);
    eventPublisher.publishEvent(new PhaseProgressEvent(jobId, view));
    return view;
  }

  public Optional<PhaseProgressView> record(
      String jobId, Phase phase, Outcome outcome, String itemLabel) {
    Optional<PhaseProgressView> view = tracker.record(jobId, phase, outcome, itemLabel);
    view.ifPresent(v -> eventPublisher.publishEvent(new PhaseProgressEvent(jobId, v)));
    return view;
  }

  public Optional<PhaseProgressView> finalizePhase(
      String jobId, Phase phase, PhaseStatus status, String errorDetail) {
    Optional<PhaseProgressView> view = tracker.finalizePhase(jobId, phase, status, errorDetail);
    view.ifPresent(v -> eventPublisher.publishEvent(new PhaseProgressEvent(jobId, v)));
    return view;
  }
}
