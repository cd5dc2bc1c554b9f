package com.scholary.songscraper.api;

import com.scholary.songscraper.job.JobSnapshot;
import com.scholary.songscraper.job.JobState;
import com.scholary.songscraper.job.SongSnapshot;
import com.scholary.songscraper.progress.PhaseProgressView;
import com.scholary.songscraper.service.JobStatusView;
import java.time.Instant;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Public status of a job.
 *
 * <p>Once the job is terminal, either {@code downloadUrl} or {@code error} is set. Blob keys are
 * not exposed.
 */
public record JobStatusResponse(
    String jobId,
    long userId,
    JobState state,
    boolean cancelRequested,
    int totalSongs,
    int completedSongs,
    int failedSongs,
    int lyricsCompleted,
    int audioCompleted,
    List<PhaseProgressView> phases,
    List<SongStatus> songs,
    String downloadUrl,
    String error,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt) {

  public static JobStatusResponse from(JobStatusView view) {
    return from(view.job(), view.phases());
  }

  public static JobStatusResponse from(JobSnapshot job, List<PhaseProgressView> phases) {
    return new JobStatusResponse(
        job.jobId(),
        job.userId(),
        job.state(),
        job.cancelRequested(),
        job.totalSongs(),
        job.completedSongs(),
        job.failedSongs(),
        job.lyricsCompleted(),
        job.audioCompleted(),
        phases,
        job.songs().stream().map(SongStatus::from).collect(Collectors.toList()),
        job.bundleUrl(),
        job.errorMessage(),
        job.createdAt(),
        job.updatedAt(),
        job.completedAt());
  }

  public record SongStatus(
      String title,
      String artist,
      String url,
      String event,
      boolean hasLyrics,
      boolean hasAudio,
      String audioFilename,
      long audioSizeBytes) {

    static SongStatus from(SongSnapshot song) {
      return new SongStatus(
          song.title(),
          song.artist(),
          song.url(),
          song.event(),
          song.hasLyrics(),
          song.hasAudio(),
          song.audioFilename(),
          song.audioSizeBytes());
    }
  }
}
