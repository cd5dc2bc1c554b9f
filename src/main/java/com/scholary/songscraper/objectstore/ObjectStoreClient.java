package com.scholary.songscraper.objectstore;

import java.io.InputStream;
import java.net.URI;
import java.net.URL;
import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Blob storage for scraped artifacts.
 *
 * <p>All keys live in one configured bucket and follow the {@code {jobId}/{artifactType}/{file}}
 * convention built by {@link BlobPaths}. Retention is enforced by the storage sweeper, not by the
 * store itself.
 */
public interface ObjectStoreClient {

  /**
   * Store an object from a stream.
   *
   * @param key the object key
   * @param data the object content
   * @param contentLength the size of the content in bytes
   * @param contentType the MIME type of the object
   * @return the location of the stored object
   * @throws ObjectStoreException if the upload fails
   */
  URI putObject(String key, InputStream data, long contentLength, String contentType);

  /**
   * Retrieve an object as a stream. The caller closes the stream.
   *
   * @throws ObjectStoreException if the object doesn't exist or retrieval fails
   */
  InputStream getObjectStream(String key);

  /**
   * Delete an object. Deleting a key that no longer exists is not an error.
   *
   * @throws ObjectStoreException if the store rejects the delete
   */
  void deleteObject(String key);

  /**
   * List every object whose key starts with the prefix. An empty prefix lists the whole bucket.
   *
   * @throws ObjectStoreException if the listing fails
   */
  List<ObjectSummary> listObjects(String prefix);

  /**
   * Generate a presigned URL for temporary read access to an object.
   *
   * @throws ObjectStoreException if URL generation fails
   */
  URL presignGet(String key, Duration ttl);

  /** Listing entry: key, size and the instant the object was written. */
  record ObjectSummary(String key, long size, Instant lastModified) {}
}
