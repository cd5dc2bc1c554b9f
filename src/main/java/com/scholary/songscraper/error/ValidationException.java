package com.scholary.songscraper.error;

/** Thrown when caller input is malformed. Raised before any state is mutated. */
public class ValidationException extends RuntimeException {

  public ValidationException(String message) {
    super(message);
  }
}
