package com.scholary.songscraper.worker;

import com.scholary.songscraper.job.ScrapeJob;

/** Callbacks from the worker pool about a dispatched job. */
public interface JobCompletionListener {

  /** The first song task of the job was admitted and the job moved from QUEUED to RUNNING. */
  void onJobStarted(ScrapeJob job);

  /**
   * No song task of the job is running and none will start: either every song was processed or
   * cancellation was requested. Called exactly once per dispatched job, on the thread that drained
   * it.
   */
  void onJobDrained(ScrapeJob job);
}
