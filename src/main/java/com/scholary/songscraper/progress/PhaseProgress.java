package com.scholary.songscraper.progress;

import java.time.Instant;

/**
 * Counter accumulator for one phase of one job.
 *
 * <p>Counters never exceed the phase total and only move forward, so the derived percentage is
 * non-decreasing. Once finalized the phase is frozen: later {@link #record} and {@link #finish}
 * calls are rejected by returning {@code false}.
 */
public class PhaseProgress {

  private final Phase phase;
  private final int total;

  private int current;
  private int succeeded;
  private int failed;
  private PhaseStatus status = PhaseStatus.RUNNING;
  private String currentItem;
  private String errorDetail;
  private Instant updatedAt;

  public PhaseProgress(Phase phase, int total, Instant openedAt) {
    if (total < 0) {
      throw new IllegalArgumentException("Phase total must not be negative: " + total);
    }
    this.phase = phase;
    this.total = total;
    this.updatedAt = openedAt;
  }

  /**
   * Count one finished item.
   *
   * @return false if the phase is already finished or every item has been counted
   */
  public synchronized boolean record(Outcome outcome, String itemLabel, Instant at) {
    if (status.isFinished() || current >= total) {
      return false;
    }
    current++;
    if (outcome == Outcome.SUCCESS) {
      succeeded++;
    } else {
      failed++;
    }
    currentItem = itemLabel;
    updatedAt = at;
    return true;
  }

  /**
   * Freeze the phase with a terminal status.
   *
   * @return false if the phase was already finished
   */
  public synchronized boolean finish(PhaseStatus terminalStatus, String detail, Instant at) {
    if (!terminalStatus.isFinished()) {
      throw new IllegalArgumentException("Cannot finish a phase as " + terminalStatus);
    }
    if (status.isFinished()) {
      return false;
    }
    status = terminalStatus;
    errorDetail = detail;
    updatedAt = at;
    return true;
  }

  public synchronized PhaseProgressView view() {
    return new PhaseProgressView(
        phase,
        current,
        total,
        succeeded,
        failed,
        percentage(current, total),
        status,
        currentItem,
        errorDetail,
        updatedAt);
  }

  public Phase getPhase() {
    return phase;
  }

  public synchronized boolean isFinished() {
    return status.isFinished();
  }

  static double percentage(int current, int total) {
    if (total <= 0) {
      return 0.0;
    }
    double raw = 100.0 * current / total;
    double clamped = Math.max(0.0, Math.min(100.0, raw));
    return Math.round(clamped * 100.0) / 100.0;
  }
}
