package com.scholary.songscraper.session;

import com.scholary.songscraper.job.SongRequest;
import java.time.Instant;
import java.util.List;

/** Read-only view of a user's session. */
public record SessionSnapshot(
    long userId,
    SessionType type,
    SessionState state,
    String expectedField,
    SongDraft draft,
    List<SongRequest> queue,
    Instant updatedAt) {}
