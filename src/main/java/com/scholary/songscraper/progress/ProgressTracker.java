package com.scholary.songscraper.progress;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Per-job, per-phase progress records.
 *
 * <p>Updates are events: {@link #record} counts one finished item, {@link #finalizePhase} freezes a
 * phase. Updates aimed at a finished phase, or at a phase that was never opened, are ignored rather
 * than treated as errors, since in-flight song tasks may race a cancellation.
 *
 * <p>Records are held in a Caffeine cache with the same retention as job records.
 */
public class ProgressTracker {

  private static final Logger LOGGER = LoggerFactory.getLogger(ProgressTracker.class);

  private final Cache<String, Map<Phase, PhaseProgress>> jobs;
  private final Clock clock;

  public ProgressTracker(Duration retention, Clock clock) {
    this.jobs = Caffeine.newBuilder().expireAfterAccess(retention).build();
    this.clock = clock;
  }

  /** Open a phase with a fixed total. Re-opening an existing phase keeps the existing record. */
  public PhaseProgressView open(String jobId, Phase phase, int total) {
    Map<Phase, PhaseProgress> phases = jobs.get(jobId, id -> new EnumMap<>(Phase.class));
    synchronized (phases) {
      return phases
          .computeIfAbsent(phase, p -> new PhaseProgress(p, total, clock.instant()))
          .view();
    }
  }

  /**
   * Count one finished item in a phase.
   *
   * @return the updated view, or empty if the update was ignored
   */
  public Optional<PhaseProgressView> record(
      String jobId, Phase phase, Outcome outcome, String itemLabel) {
    return find(jobId, phase)
        .flatMap(
            progress -> {
              if (progress.record(outcome, itemLabel, clock.instant())) {
                return Optional.of(progress.view());
              }
              LOGGER.debug("Ignored {} update for finished phase: jobId={}", phase, jobId);
              return Optional.empty();
            });
  }

  /**
   * Freeze a phase.
   *
   * @return the final view, or empty if the phase was unknown or already finished
   */
  public Optional<PhaseProgressView> finalizePhase(
      String jobId, Phase phase, PhaseStatus status, String errorDetail) {
    return find(jobId, phase)
        .flatMap(
            progress -> {
              if (progress.finish(status, errorDetail, clock.instant())) {
                return Optional.of(progress.view());
              }
              return Optional.empty();
            });
  }

  /** Snapshot of every opened phase of a job, in phase order. */
  public List<PhaseProgressView> phases(String jobId) {
    Map<Phase, PhaseProgress> phases = jobs.getIfPresent(jobId);
    if (phases == null) {
      return List.of();
    }
    List<PhaseProgressView> views = new ArrayList<>();
    synchronized (phases) {
      for (PhaseProgress progress : phases.values()) {
        views.add(progress.view());
      }
    }
    return views;
  }

  public Optional<PhaseProgressView> phase(String jobId, Phase phase) {
    return find(jobId, phase).map(PhaseProgress::view);
  }

  private Optional<PhaseProgress> find(String jobId, Phase phase) {
    Map<Phase, PhaseProgress> phases = jobs.getIfPresent(jobId);
    if (phases == null) {
      LOGGER.debug("No progress records for job: jobId={}", jobId);
      return Optional.empty();
    }
    synchronized (phases) {
      return Optional.ofNullable(phases.get(phase));
    }
  }
}
