package com.scholary.songscraper.notification;

import com.scholary.songscraper.job.JobState;
import java.time.Instant;

/**
 * Final notification for a job, published once it reaches a terminal state.
 *
 * @param bundleUrl download link, set only for completed jobs
 * @param errorMessage failure summary, set only for failed jobs
 */
public record JobFinishedEvent(
    String jobId,
    long userId,
    JobState state,
    int totalSongs,
    int completedSongs,
    int failedSongs,
    String bundleUrl,
    String errorMessage,
    Instant finishedAt) {}
