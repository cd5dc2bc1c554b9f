package com.scholary.songscraper.config;

import com.scholary.songscraper.progress.ProgressTracker;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Core engine beans.
 *
 * <p>The clock is the single time source for job timestamps, progress records and artifact TTLs.
 */
@Configuration
@EnableConfigurationProperties(ScraperProperties.class)
public class EngineConfig {

  @Bean
  public Clock clock() {
    return Clock.systemUTC();
  }

  @Bean
  public ProgressTracker progressTracker(ScraperProperties properties, Clock clock) {
    return new ProgressTracker(properties.retention(), clock);
  }
}
