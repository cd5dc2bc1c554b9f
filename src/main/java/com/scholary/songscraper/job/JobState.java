package com.scholary.songscraper.job;

/**
 * Lifecycle of a scrape job.
 *
 * <p>Transitions only move forward along {@code QUEUED -> RUNNING -> ARCHIVING -> COMPLETED|FAILED}
 * (steps may be skipped), and {@code CANCELLED} is reachable from QUEUED or RUNNING only.
 */
public enum JobState {
  QUEUED(0),
  RUNNING(1),
  ARCHIVING(2),
  COMPLETED(3),
  FAILED(3),
  CANCELLED(3);

  private final int rank;

  JobState(int rank) {
    this.rank = rank;
  }

  public boolean isTerminal() {
    return rank == 3;
  }

  public boolean canTransitionTo(JobState next) {
    if (isTerminal()) {
      return false;
    }
    if (next == CANCELLED) {
      return this == QUEUED || this == RUNNING;
    }
    return next.rank > rank;
  }
}
