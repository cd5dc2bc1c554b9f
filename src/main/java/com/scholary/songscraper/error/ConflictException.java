package com.scholary.songscraper.error;

/**
 * Thrown when an operation collides with existing state, such as a second active session or a
 * repeated cancel.
 */
public class ConflictException extends RuntimeException {

  public ConflictException(String message) {
    super(message);
  }
}
