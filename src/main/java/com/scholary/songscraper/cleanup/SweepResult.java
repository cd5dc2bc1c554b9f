package com.scholary.songscraper.cleanup;

/**
 * Outcome of one sweep.
 *
 * @param scanned blobs listed
 * @param expired blobs past their TTL and not yet logged
 * @param deleted blobs deleted and logged by this sweep
 * @param errors blobs whose deletion failed
 */
public record SweepResult(int scanned, int expired, int deleted, int errors) {}
