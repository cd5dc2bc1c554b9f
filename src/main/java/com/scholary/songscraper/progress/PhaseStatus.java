package com.scholary.songscraper.progress;

/** Lifecycle of a single phase. A phase leaves RUNNING exactly once. */
public enum PhaseStatus {
  RUNNING,
  COMPLETED,
  FAILED;

  public boolean isFinished() {
    return this != RUNNING;
  }
}
