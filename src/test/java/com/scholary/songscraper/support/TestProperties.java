package com.scholary.songscraper.support;

import com.scholary.songscraper.config.ScraperProperties;

/** Property sets for unit tests. */
public final class TestProperties {

  private TestProperties() {}

  public static ScraperProperties scraper() {
    return new ScraperProperties(3, 100, 10, 3600, 3600, 600, 24);
  }
}
