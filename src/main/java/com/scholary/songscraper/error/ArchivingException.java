package com.scholary.songscraper.error;

/**
 * Thrown when the bundle for a job cannot be built or stored.
 *
 * <p>Fatal for the job it belongs to, never for the process.
 */
public class ArchivingException extends RuntimeException {

  public ArchivingException(String message) {
    super(message);
  }

  public ArchivingException(String message, Throwable cause) {
    super(message, cause);
  }
}
