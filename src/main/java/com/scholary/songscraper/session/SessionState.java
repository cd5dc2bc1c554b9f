package com.scholary.songscraper.session;

/**
 * States of the song-list builder.
 *
 * <pre>
 * IDLE -> AWAITING_TITLE -> AWAITING_ARTIST -> AWAITING_URL -> AWAITING_CONFIRMATION
 *                ^                                                   |
 *                +------------------- confirm -----------------------+
 * </pre>
 *
 * <p>{@code finish} leaves AWAITING_TITLE for IDLE; {@code cancel} leaves any active state for
 * IDLE.
 */
public enum SessionState {
  IDLE(null),
  AWAITING_TITLE("title"),
  AWAITING_ARTIST("artist"),
  AWAITING_URL("url"),
  AWAITING_CONFIRMATION("event");

  private final String expectedField;

  SessionState(String expectedField) {
    this.expectedField = expectedField;
  }

  /** The field {@code submitField} accepts in this state, or null when idle. */
  public String expectedField() {
    return expectedField;
  }

  public boolean isActive() {
    return this != IDLE;
  }
}
