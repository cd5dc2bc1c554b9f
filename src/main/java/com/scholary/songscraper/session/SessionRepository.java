package com.scholary.songscraper.session;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.scholary.songscraper.config.ScraperProperties;
import java.time.Clock;
import java.util.Optional;
import org.springframework.stereotype.Repository;

/** One session object per (user, type), expired after the retention period without access. */
@Repository
public class SessionRepository {

  private final Cache<SessionKey, UserSession> sessions;
  private final Clock clock;

  public SessionRepository(ScraperProperties properties, Clock clock) {
    this.sessions = Caffeine.newBuilder().expireAfterAccess(properties.retention()).build();
    this.clock = clock;
  }

  public UserSession getOrCreate(long userId, SessionType type) {
    return sessions.get(
        new SessionKey(userId, type), key -> new UserSession(userId, type, clock.instant()));
  }

  public Optional<UserSession> find(long userId, SessionType type) {
    return Optional.ofNullable(sessions.getIfPresent(new SessionKey(userId, type)));
  }

  private record SessionKey(long userId, SessionType type) {}
}
