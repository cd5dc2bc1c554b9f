package com.scholary.songscraper.worker;

import com.scholary.songscraper.job.ScrapeJob;
import java.time.Instant;

/**
 * Book-keeping for one dispatched job: how many song tasks are still queued and how many are
 * running. The cancellation check at task start and the drain check share this lock, so a task
 * either sees the cancel flag and is skipped or is counted as in flight before the drain check
 * runs.
 */
final class JobExecution {

  enum Admission {
    FIRST,
    ADMITTED,
    SKIPPED
  }

  private final ScrapeJob job;
  private final JobCompletionListener listener;
  private int pending;
  private int inFlight;
  private boolean started;
  private boolean drained;

  JobExecution(ScrapeJob job, JobCompletionListener listener) {
    this.job = job;
    this.listener = listener;
    this.pending = job.getTotalSongs();
  }

  /** Take one queued task off the pending count and decide whether it may run. */
  synchronized Admission admit(Instant at) {
    pending--;
    if (job.isCancelRequested()) {
      return Admission.SKIPPED;
    }
    inFlight++;
    if (!started) {
      started = true;
      if (job.markRunning(at)) {
        return Admission.FIRST;
      }
    }
    return Admission.ADMITTED;
  }

  synchronized void release() {
    inFlight--;
  }

  /** A queued task that will never run, e.g. rejected by a shut down executor. */
  synchronized void abandon() {
    pending--;
  }

  /**
   * Claim the right to resolve the job.
   *
   * @return true exactly once, when nothing runs and nothing more will start
   */
  synchronized boolean claimDrain() {
    if (drained || inFlight > 0) {
      return false;
    }
    if (pending > 0 && !job.isCancelRequested()) {
      return false;
    }
    drained = true;
    return true;
  }

  ScrapeJob job() {
    return job;
  }

  JobCompletionListener listener() {
    return listener;
  }
}
