package com.scholary.songscraper.job;

import java.time.Instant;
import java.util.List;

/** Immutable, internally consistent view of a job at one instant. */
public record JobSnapshot(
    String jobId,
    long userId,
    JobState state,
    boolean cancelRequested,
    int totalSongs,
    int completedSongs,
    int failedSongs,
    int lyricsCompleted,
    int audioCompleted,
    String bundleKey,
    String bundleUrl,
    String errorMessage,
    Instant createdAt,
    Instant updatedAt,
    Instant completedAt,
    List<SongSnapshot> songs) {}
