package com.scholary.songscraper.objectstore;

/**
 * Thrown when a blob store operation fails.
 *
 * <p>Unchecked: callers that can isolate the failure (a single artifact, a single swept blob)
 * catch it; everything else lets it surface.
 */
public class ObjectStoreException extends RuntimeException {

  public ObjectStoreException(String message) {
    super(message);
  }

  public ObjectStoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
