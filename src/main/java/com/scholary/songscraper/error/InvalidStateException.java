package com.scholary.songscraper.error;

/** Thrown when an operation is not legal in the current lifecycle state of a job or session. */
public class InvalidStateException extends RuntimeException {

  public InvalidStateException(String message) {
    super(message);
  }
}
