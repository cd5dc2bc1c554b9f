package com.scholary.songscraper.config;

import com.scholary.songscraper.objectstore.InMemoryObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreProperties;
import com.scholary.songscraper.objectstore.S3ObjectStoreClient;
import java.time.Clock;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * Configuration for artifact storage.
 *
 * <p>{@code objectstore.type} picks the implementation: {@code s3} for S3 or MinIO, {@code memory}
 * for a process-local store.
 */
@Configuration
@EnableConfigurationProperties(ObjectStoreProperties.class)
public class ObjectStoreConfig {

  @Bean
  public ObjectStoreClient objectStoreClient(ObjectStoreProperties properties, Clock clock) {
    if (properties.type() == ObjectStoreProperties.StoreType.MEMORY) {
      return new InMemoryObjectStoreClient(properties.bucket(), clock);
    }
    return new S3ObjectStoreClient(properties);
  }
}
