package com.scholary.songscraper.job;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.github.benmanes.caffeine.cache.Ticker;
import com.scholary.songscraper.config.ScraperProperties;
import com.scholary.songscraper.error.ConflictException;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Repository;

/**
 * In-memory record store for scrape jobs and their songs.
 *
 * <p>Backed by a Caffeine cache. Nothing in the service removes a job; the cache forgets a record
 * once it has gone unread for {@code scraper.retention-hours}, which is this store's stand-in for
 * an external retention policy. Job identity is unique: inserting an existing id is a conflict.
 */
@Repository
public class JobRepository {

  private final Cache<String, ScrapeJob> cache;

  @Autowired
  public JobRepository(ScraperProperties properties) {
    this(properties, Ticker.systemTicker());
  }

  JobRepository(ScraperProperties properties, Ticker ticker) {
    this.cache =
        Caffeine.newBuilder().expireAfterAccess(properties.retention()).ticker(ticker).build();
  }

  public void insert(ScrapeJob job) {
    ScrapeJob existing = cache.asMap().putIfAbsent(job.getJobId(), job);
    if (existing != null) {
      throw new ConflictException("Job id already in use: " + job.getJobId());
    }
  }

  public Optional<ScrapeJob> findById(String jobId) {
    return Optional.ofNullable(cache.getIfPresent(jobId));
  }

  /** Jobs owned by a user, newest first. */
  public List<ScrapeJob> findByUserId(long userId) {
    return cache.asMap().values().stream()
        .filter(job -> job.getUserId() == userId)
        .sorted(
            Comparator.comparing(ScrapeJob::getCreatedAt)
                .reversed()
                .thenComparing(ScrapeJob::getJobId, Comparator.reverseOrder()))
        .collect(Collectors.toList());
  }

  public List<ScrapeJob> findAll() {
    return List.copyOf(cache.asMap().values());
  }
}
