package com.scholary.songscraper.service;

import java.time.Clock;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import org.springframework.stereotype.Component;

/** Job ids of the form {@code {userId}_{yyyyMMdd_HHmmss}_{8 hex chars}}. */
@Component
public class JobIdGenerator {

  private static final DateTimeFormatter TIMESTAMP =
      DateTimeFormatter.ofPattern("yyyyMMdd_HHmmss").withZone(ZoneOffset.UTC);

  private final Clock clock;

  public JobIdGenerator(Clock clock) {
    this.clock = clock;
  }

  public String next(long userId) {
    String suffix = UUID.randomUUID().toString().replace("-", "").substring(0, 8);
    return userId + "_" + TIMESTAMP.format(clock.instant()) + "_" + suffix;
  }
}
