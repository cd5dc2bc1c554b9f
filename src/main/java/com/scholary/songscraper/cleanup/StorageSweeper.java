package com.scholary.songscraper.cleanup;

import com.scholary.songscraper.config.ScraperProperties;
import com.scholary.songscraper.job.JobRepository;
import com.scholary.songscraper.job.ScrapeJob;
import com.scholary.songscraper.job.SongItem;
import com.scholary.songscraper.logging.StructuredLogger;
import com.scholary.songscraper.objectstore.ArtifactType;
import com.scholary.songscraper.objectstore.BlobPaths;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreClient.ObjectSummary;
import com.scholary.songscraper.objectstore.ObjectStoreException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

/**
 * Deletes artifacts older than the TTL.
 *
 * <p>Runs on a fixed delay. Each expired artifact blob that the cleanup log does not know yet is
 * deleted from the object store, logged once, and its reference dropped from the owning job. A
 * failure on one blob is logged and counted; the sweep carries on with the rest. Keys outside the
 * {@code {jobId}/{type}/{file}} layout are left alone, and so are blobs of jobs that have not
 * reached a terminal state yet; those expire on the first sweep after the job ends.
 */
@Component
public class StorageSweeper {

  private static final Logger LOGGER = LoggerFactory.getLogger(StorageSweeper.class);
  static final String REASON_TTL = "auto_delete";

  private final ObjectStoreClient objectStore;
  private final CleanupLogRepository cleanupLog;
  private final JobRepository jobRepository;
  private final Duration ttl;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  public StorageSweeper(
      ObjectStoreClient objectStore,
      CleanupLogRepository cleanupLog,
      JobRepository jobRepository,
      ScraperProperties properties,
      Clock clock) {
    this.objectStore = objectStore;
    this.cleanupLog = cleanupLog;
    this.jobRepository = jobRepository;
    this.ttl = properties.artifactTtl();
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  @Scheduled(
      fixedDelayString = "${scraper.sweep-interval-seconds:3600}",
      initialDelayString = "${scraper.sweep-interval-seconds:3600}",
      timeUnit = TimeUnit.SECONDS)
  public void scheduledSweep() {
    try {
      sweep(clock.instant());
    } catch (ObjectStoreException e) {
      LOGGER.error("Storage sweep aborted, listing failed: {}", e.getMessage(), e);
    }
  }

  /**
   * Sweep as of the given instant.
   *
   * @throws ObjectStoreException if the store cannot be listed
   */
  public synchronized SweepResult sweep(Instant now) {
    long startTime = System.currentTimeMillis();
    Instant cutoff = now.minus(ttl);
    List<ObjectSummary> objects = objectStore.listObjects("");

    int expired = 0;
    int deleted = 0;
    int errors = 0;
    for (ObjectSummary object : objects) {
      Optional<BlobPaths.ParsedKey> parsed = BlobPaths.parse(object.key());
      if (parsed.isEmpty()
          || !object.lastModified().isBefore(cutoff)
          || cleanupLog.contains(object.key())) {
        continue;
      }
      if (ownedByActiveJob(parsed.get().jobId())) {
        LOGGER.debug("Keeping expired blob of unfinished job: key={}", object.key());
        continue;
      }
      expired++;
      try {
        if (delete(object, parsed.get(), now)) {
          deleted++;
        }
      } catch (ObjectStoreException e) {
        errors++;
        LOGGER.warn("Failed to delete expired blob: key={}: {}", object.key(), e.getMessage());
      } catch (RuntimeException e) {
        errors++;
        LOGGER.error("Unexpected error deleting expired blob: key={}", object.key(), e);
      }
    }

    structuredLogger.logSweepFinished(
        objects.size(), deleted, errors, System.currentTimeMillis() - startTime);
    return new SweepResult(objects.size(), expired, deleted, errors);
  }

  private boolean delete(ObjectSummary object, BlobPaths.ParsedKey key, Instant now) {
    objectStore.deleteObject(object.key());

    CleanupRecord record =
        new CleanupRecord(
            object.key(),
            key.type().folder(),
            object.size(),
            key.jobId(),
            REASON_TTL,
            now);
    if (!cleanupLog.append(record)) {
      return false;
    }

    releaseReference(key, object.key());
    structuredLogger.logBlobDeleted(
        object.key(),
        key.type().folder(),
        object.size(),
        Duration.between(object.lastModified(), now).getSeconds());
    return true;
  }

  private boolean ownedByActiveJob(String jobId) {
    return jobRepository
        .findById(jobId)
        .map(job -> !job.getState().isTerminal())
        .orElse(false);
  }

  private void releaseReference(BlobPaths.ParsedKey key, String blobKey) {
    Optional<ScrapeJob> job = jobRepository.findById(key.jobId());
    if (job.isEmpty()) {
      return;
    }
    if (key.type() == ArtifactType.BUNDLE) {
      job.get().releaseBundle(blobKey);
      return;
    }
    for (SongItem song : job.get().getSongs()) {
      if (song.releaseBlob(blobKey)) {
        return;
      }
    }
  }
}
