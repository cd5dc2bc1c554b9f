package com.scholary.songscraper.error;

/** Thrown when a job or session does not exist. */
public class NotFoundException extends RuntimeException {

  public NotFoundException(String message) {
    super(message);
  }
}
