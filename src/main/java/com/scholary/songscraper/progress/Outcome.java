package com.scholary.songscraper.progress;

/** Result of one unit of work inside a phase. */
public enum Outcome {
  SUCCESS,
  FAILURE
}
