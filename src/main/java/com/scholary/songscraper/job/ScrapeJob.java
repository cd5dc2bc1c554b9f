package com.scholary.songscraper.job;

import com.scholary.songscraper.error.ConflictException;
import com.scholary.songscraper.error.InvalidStateException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A scrape request for a fixed list of songs, tracked end to end.
 *
 * <p>The song total is fixed at creation and {@code completed + failed <= total} holds at all
 * times. State transitions follow {@link JobState#canTransitionTo}; anything else is rejected with
 * {@link InvalidStateException}. All mutators are synchronized on the job so that snapshots are
 * internally consistent.
 */
public class ScrapeJob {

  /** Failure reasons quoted verbatim in an aggregate error message. */
  static final int MAX_QUOTED_FAILURES = 5;

  private final String jobId;
  private final long userId;
  private final List<SongItem> songs;
  private final int totalSongs;
  private final Instant createdAt;

  private JobState state = JobState.QUEUED;
  private volatile boolean cancelRequested;
  private int completedSongs;
  private int failedSongs;
  private int lyricsCompleted;
  private int audioCompleted;
  private final List<String> failureReasons = new ArrayList<>();
  private String bundleKey;
  private String bundleUrl;
  private String errorMessage;
  private Instant updatedAt;
  private Instant completedAt;

  public ScrapeJob(String jobId, long userId, List<SongRequest> requests, Instant createdAt) {
    this.jobId = jobId;
    this.userId = userId;
    List<SongItem> items = new ArrayList<>(requests.size());
    for (int i = 0; i < requests.size(); i++) {
      items.add(new SongItem(i, requests.get(i)));
    }
    this.songs = Collections.unmodifiableList(items);
    this.totalSongs = items.size();
    this.createdAt = createdAt;
    this.updatedAt = createdAt;
  }

  /**
   * Move to the next state.
   *
   * @return the state the job left
   * @throws InvalidStateException if the transition is not allowed
   */
  public synchronized JobState transitionTo(JobState next, Instant at) {
    if (!state.canTransitionTo(next)) {
      throw new InvalidStateException(
          String.format("Job %s cannot move from %s to %s", jobId, state, next));
    }
    JobState previous = state;
    state = next;
    updatedAt = at;
    if (next.isTerminal()) {
      completedAt = at;
    }
    return previous;
  }

  /**
   * Move from QUEUED to RUNNING unless cancellation was requested first.
   *
   * @return true if the job moved
   */
  public synchronized boolean markRunning(Instant at) {
    if (state != JobState.QUEUED || cancelRequested) {
      return false;
    }
    transitionTo(JobState.RUNNING, at);
    return true;
  }

  /**
   * Raise the cooperative cancellation flag.
   *
   * @throws InvalidStateException if the job is archiving or already terminal
   * @throws ConflictException if cancellation was already requested
   */
  public synchronized void requestCancellation(Instant at) {
    if (!state.canTransitionTo(JobState.CANCELLED)) {
      throw new InvalidStateException(
          String.format("Job %s cannot be cancelled in state %s", jobId, state));
    }
    if (cancelRequested) {
      throw new ConflictException("Cancellation already requested for job " + jobId);
    }
    cancelRequested = true;
    updatedAt = at;
  }

  public boolean isCancelRequested() {
    return cancelRequested;
  }

  /**
   * Count a processed song. A song fails only when neither artifact could be obtained.
   *
   * @param failureReason why artifacts were missing, or null if both were obtained
   */
  public synchronized void recordSongOutcome(
      SongItem song, boolean gotLyrics, boolean gotAudio, String failureReason, Instant at) {
    if (completedSongs + failedSongs >= totalSongs) {
      throw new IllegalStateException(
          String.format("Job %s already counted all %d songs", jobId, totalSongs));
    }
    if (gotLyrics) {
      lyricsCompleted++;
    }
    if (gotAudio) {
      audioCompleted++;
    }
    if (gotLyrics || gotAudio) {
      completedSongs++;
    } else {
      failedSongs++;
    }
    if (failureReason != null) {
      failureReasons.add(song.getTitle() + ": " + failureReason);
    }
    updatedAt = at;
  }

  /**
   * Decide how a job whose song tasks have all drained ends, and apply the state change for that
   * decision. Cancellation wins over everything else; a job where every song failed, or where no
   * song was processed at all, fails; anything else moves to ARCHIVING.
   */
  public synchronized Resolution beginResolution(Instant at) {
    if (cancelRequested) {
      transitionTo(JobState.CANCELLED, at);
      return Resolution.CANCELLED;
    }
    if (totalSongs > 0 && failedSongs == totalSongs) {
      errorMessage = aggregateFailureMessage();
      transitionTo(JobState.FAILED, at);
      return Resolution.FAILED;
    }
    if (completedSongs == 0) {
      errorMessage = "No songs were processed";
      transitionTo(JobState.FAILED, at);
      return Resolution.FAILED;
    }
    transitionTo(JobState.ARCHIVING, at);
    return Resolution.ARCHIVE;
  }

  public synchronized void completeArchiving(String bundleKey, String bundleUrl, Instant at) {
    transitionTo(JobState.COMPLETED, at);
    this.bundleKey = bundleKey;
    this.bundleUrl = bundleUrl;
  }

  public synchronized void failArchiving(String message, Instant at) {
    transitionTo(JobState.FAILED, at);
    this.errorMessage = message;
  }

  /**
   * Drop the reference to a deleted bundle.
   *
   * @return true if the job referenced the key
   */
  public synchronized boolean releaseBundle(String blobKey) {
    if (bundleKey == null || !bundleKey.equals(blobKey)) {
      return false;
    }
    bundleKey = null;
    bundleUrl = null;
    return true;
  }

  public synchronized JobSnapshot snapshot() {
    return new JobSnapshot(
        jobId,
        userId,
        state,
        cancelRequested,
        totalSongs,
        completedSongs,
        failedSongs,
        lyricsCompleted,
        audioCompleted,
        bundleKey,
        bundleUrl,
        errorMessage,
        createdAt,
        updatedAt,
        completedAt,
        songs.stream().map(SongItem::snapshot).collect(Collectors.toList()));
  }

  private String aggregateFailureMessage() {
    StringBuilder message =
        new StringBuilder(String.format("All %d songs failed", totalSongs));
    int quoted = Math.min(failureReasons.size(), MAX_QUOTED_FAILURES);
    if (quoted > 0) {
      message.append(": ").append(String.join("; ", failureReasons.subList(0, quoted)));
    }
    if (failureReasons.size() > quoted) {
      message.append(String.format(" (and %d more)", failureReasons.size() - quoted));
    }
    return message.toString();
  }

  public String getJobId() {
    return jobId;
  }

  public long getUserId() {
    return userId;
  }

  public List<SongItem> getSongs() {
    return songs;
  }

  public int getTotalSongs() {
    return totalSongs;
  }

  public Instant getCreatedAt() {
    return createdAt;
  }

  public synchronized JobState getState() {
    return state;
  }

  /** How a drained job ends. */
  public enum Resolution {
    ARCHIVE,
    FAILED,
    CANCELLED
  }
}
