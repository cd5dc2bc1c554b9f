package com.scholary.songscraper.fetch;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration for the HTTP song fetcher, bound from {@code fetcher.*}.
 *
 * <p>Timeouts are in seconds. {@code retryBackoffMs} is the base of the exponential backoff
 * between attempts.
 */
@ConfigurationProperties(prefix = "fetcher")
@Validated
public record FetcherProperties(
    @Positive int connectTimeout,
    @Positive int readTimeout,
    @Positive int downloadTimeout,
    @Positive int maxRetries,
    @PositiveOrZero long retryBackoffMs,
    @Positive long maxAudioBytes,
    @NotBlank String userAgent,
    @Positive int pageCacheMinutes) {}
