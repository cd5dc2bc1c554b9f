package com.scholary.songscraper.cleanup;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.songscraper.config.ScraperProperties;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * Append-only log of blob deletions, keyed by blob path.
 *
 * <p>The sweeper consults this log, not the object store, to decide whether a blob was already
 * handled. Records are never rewritten. The cache forgets them {@code scraper.retention-hours}
 * after they were written, the stand-in for an external retention policy; a blob still listed
 * after that is simply deleted and logged again.
 */
@Repository
public class CleanupLogRepository {

  private final Cache<String, CleanupRecord> records;

  @Autowired
  public CleanupLogRepository(ScraperProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  CleanupLogRepository(ScraperProperties properties, Ticker ticker) {
    this.records =
        Caffeine.newBuilder().expireAfterWrite(properties.retention()).ticker(ticker).build();
  }

  /**
   * Append a record unless one already exists for its path.
   *
   * @return true if the record was appended
   */
  public boolean append(CleanupRecord record) {
    return records.asMap().putIfAbsent(record.path(), record) == null;
  }

  public boolean contains(String path) {
    return records.getIfPresent(path) != null;
  }

  /** All records, oldest deletion first. */
  public List<CleanupRecord> findAll() {
    return records.asMap().values().stream()
        .sorted(Comparator.comparing(CleanupRecord::deletedAt).thenComparing(CleanupRecord::path))
        .collect(Collectors.toList());
  }

  public List<CleanupRecord> findByJobId(String jobId) {
    return findAll().stream()
        .filter(record -> jobId.equals(record.jobId()))
        .collect(Collectors.toList());
  }
}
