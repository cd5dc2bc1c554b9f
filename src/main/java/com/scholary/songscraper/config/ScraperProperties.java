package com.scholary.songscraper.config;

import jakarta.validation.constraints.Positive;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Operational controls for the scraping engine, bound from {@code scraper.*}.
 *
 * @param maxConcurrentWorkers song tasks allowed to run at once, across all jobs
 * @param maxQueuedSongs song tasks allowed to wait for a worker, across all jobs
 * @param maxBatchSize most songs accepted in one job
 * @param artifactTtlSeconds age after which stored artifacts are deleted
 * @param sweepIntervalSeconds delay between storage sweeps
 * @param downloadUrlTtlSeconds lifetime of presigned bundle links
 * @param retentionHours how long job, progress and session records are kept in memory
 */
@ConfigurationProperties(prefix = "scraper")
@Validated
public record ScraperProperties(
    @Positive int maxConcurrentWorkers,
    @Positive int maxQueuedSongs,
    @Positive int maxBatchSize,
    @Positive long artifactTtlSeconds,
    @Positive long sweepIntervalSeconds,
    @Positive long downloadUrlTtlSeconds,
    @Positive long retentionHours) {

  public Duration artifactTtl() {
    return Duration.ofSeconds(artifactTtlSeconds);
  }

  public Duration downloadUrlTtl() {
    return Duration.ofSeconds(downloadUrlTtlSeconds);
  }

  public Duration retention() {
    return Duration.ofHours(retentionHours);
  }
}
