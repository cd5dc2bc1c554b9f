package com.scholary.songscraper.notification;

import com.scholary.songscraper.job.JobState;
import java.time.Instant;

/** Published whenever a job changes state. */
public record JobStateChangedEvent(
    String jobId, long userId, JobState from, JobState to, Instant at) {}
