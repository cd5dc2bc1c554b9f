package com.scholary.songscraper.fetch;

/**
 * Thrown when one artifact of one song cannot be fetched.
 *
 * <p>Recovered by the worker, which marks that artifact absent; it never fails a job by itself.
 */
public class FetchException extends RuntimeException {

  public FetchException(String message) {
    super(message);
  }

  public FetchException(String message, Throwable cause) {
    super(message, cause);
  }
}
