package com.scholary.songscraper.objectstore;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the artifact store, bound from {@code objectstore.*}.
 *
 * <p>{@code type=memory} keeps blobs in the process; the S3 settings are then ignored.
 */
@ConfigurationProperties(prefix = "objectstore")
@Validated
public record ObjectStoreProperties(
    @NotNull StoreType type,
    String endpoint,
    String accessKey,
    String secretKey,
    @NotBlank String bucket,
    String region,
    boolean pathStyleAccess) {

  public enum StoreType {
    S3,
    MEMORY
  }
}
