package com.scholary.songscraper.objectstore;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.MalformedURLException;
import java.net.URI;
import java.net.URISyntaxException;
import java.net.URL;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-local ObjectStoreClient, selected with {@code objectstore.type=memory}.
 *
 * <p>Used for local runs and tests. Write timestamps come from the injected clock so TTL behaviour
 * can be driven deterministically.
 */
public class InMemoryObjectStoreClient implements ObjectStoreClient {

  private static final Logger LOGGER = LoggerFactory.getLogger(InMemoryObjectStoreClient.class);

  private final Map<String, StoredObject> objects = new ConcurrentHashMap<>();
  private final String bucket;
  private final Clock clock;

  public InMemoryObjectStoreClient(String bucket, Clock clock) {
    this.bucket = bucket;
    this.clock = clock;
    LOGGER.info("Initialized in-memory object store: bucket={}", bucket);
  }

  @Override
  public URI putObject(String key, InputStream data, long contentLength, String contentType) {
    try {
      byte[] bytes = data.readAllBytes();
      if (bytes.length != contentLength) {
        throw new ObjectStoreException(
            String.format(
                "Content length mismatch: key=%s, declared=%d, actual=%d",
                key, contentLength, bytes.length));
      }
      objects.put(key, new StoredObject(bytes, contentType, clock.instant()));
      LOGGER.debug("Stored object: key={}, bytes={}", key, bytes.length);
      return new URI("memory", bucket, "/" + key, null);
    } catch (IOException e) {
      throw new ObjectStoreException("Failed to read upload stream: key=" + key, e);
    } catch (URISyntaxException e) {
      throw new ObjectStoreException("Stored object has an invalid key: " + key, e);
    }
  }

  @Override
  public InputStream getObjectStream(String key) {
    StoredObject object = objects.get(key);
    if (object == null) {
      throw new ObjectStoreException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key));
    }
    return new ByteArrayInputStream(object.bytes());
  }

  @Override
  public void deleteObject(String key) {
    objects.remove(key);
    LOGGER.debug("Deleted object: key={}", key);
  }

  @Override
  public List<ObjectSummary> listObjects(String prefix) {
    return objects.entrySet().stream()
        .filter(e -> e.getKey().startsWith(prefix))
        .map(
            e ->
                new ObjectSummary(
                    e.getKey(), e.getValue().bytes().length, e.getValue().storedAt()))
        .sorted(Comparator.comparing(ObjectSummary::key))
        .collect(Collectors.toList());
  }

  @Override
  public URL presignGet(String key, Duration ttl) {
    if (!objects.containsKey(key)) {
      throw new ObjectStoreException(
          String.format("Object not found: bucket=%s, key=%s", bucket, key));
    }
    long expires = clock.instant().plus(ttl).getEpochSecond();
    try {
      return new URI("http", "localhost", "/" + bucket + "/" + key, "expires=" + expires, null)
          .toURL();
    } catch (URISyntaxException | MalformedURLException e) {
      throw new ObjectStoreException("Failed to build download URL: key=" + key, e);
    }
  }

  public boolean contains(String key) {
    return objects.containsKey(key);
  }

  private record StoredObject(byte[] bytes, String contentType, Instant storedAt) {}
}
