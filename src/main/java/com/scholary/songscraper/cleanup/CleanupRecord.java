package com.scholary.songscraper.cleanup;

import java.time.Instant;

/**
 * Audit entry for one deleted blob. Written once, never changed.
 *
 * @param jobId owning job, or null if the key did not carry one
 */
public record CleanupRecord(
    String path,
    String artifactType,
    long sizeBytes,
    String jobId,
    String reason,
    Instant deletedAt) {}
