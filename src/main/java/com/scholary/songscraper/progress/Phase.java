package com.scholary.songscraper.progress;

/** Independently tracked progress stages of a scrape job. */
public enum Phase {
  LYRICS,
  AUDIO,
  ARCHIVING
}
