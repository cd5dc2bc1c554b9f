package com.scholary.songscraper.notification;

import com.scholary.songscraper.progress.PhaseProgressView;

/** Published after every accepted progress update and when a phase is finalized. */
public record PhaseProgressEvent(String jobId, PhaseProgressView progress) {}
