package com.scholary.songscraper.api;

/**
 * Response for an accepted job.
 *
 * <p>Returns the job ID to poll for status.
 */
public record AsyncJobResponse(String jobId, String statusUrl) {}
