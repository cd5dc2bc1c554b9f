package com.scholary.songscraper.fetch;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.URLDecoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.OptionalLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * HTTP implementation of SongFetcher using the JDK HttpClient.
 *
 * <p>Every request has a bounded timeout. IO failures, timeouts and 5xx answers are retried with
 * exponential backoff and jitter up to {@code maxRetries} attempts; 4xx answers and pages without
 * the wanted artifact fail immediately. Fetched pages are cached for a few minutes so that the
 * audio fetch for a song reuses the page downloaded for its lyrics.
 */
public class HttpSongFetcher implements SongFetcher {

  private static final Logger LOGGER = LoggerFactory.getLogger(HttpSongFetcher.class);

  private final HttpClient httpClient;
  private final FetcherProperties properties;
  private final SongPageParser parser;
  private final Cache<String, String> pageCache;

  public HttpSongFetcher(FetcherProperties properties, SongPageParser parser) {
    this.properties = properties;
    this.parser = parser;
    this.httpClient =
        HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(properties.connectTimeout()))
            .followRedirects(HttpClient.Redirect.NORMAL)
            .build();
    this.pageCache =
        Caffeine.newBuilder()
            .maximumSize(500)
            .expireAfterWrite(Duration.ofMinutes(properties.pageCacheMinutes()))
            .build();

    LOGGER.info(
        "Initialized song fetcher: connectTimeout={}s, readTimeout={}s, maxRetries={}",
        properties.connectTimeout(),
        properties.readTimeout(),
        properties.maxRetries());
  }

  @Override
  public String fetchLyrics(String sourceUrl) {
    String html = fetchPage(sourceUrl);
    return parser
        .extractLyrics(html)
        .orElseThrow(() -> new FetchException("No lyrics found on page: " + sourceUrl));
  }

  @Override
  public FetchedAudio fetchAudio(String sourceUrl) {
    String html = fetchPage(sourceUrl);
    URI audioUrl =
        parser
            .extractAudioUrl(html, URI.create(sourceUrl))
            .orElseThrow(() -> new FetchException("No audio link found on page: " + sourceUrl));

    LOGGER.debug("Downloading audio: page={}, audio={}", sourceUrl, audioUrl);
    return withRetries("audio " + audioUrl, () -> attemptDownload(audioUrl));
  }

  private String fetchPage(String sourceUrl) {
    String cached = pageCache.getIfPresent(sourceUrl);
    if (cached != null) {
      return cached;
    }
    URI uri = parseUrl(sourceUrl);
    String html = withRetries("page " + sourceUrl, () -> attemptPage(uri));
    pageCache.put(sourceUrl, html);
    return html;
  }

  private String attemptPage(URI uri) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.readTimeout()))
            .header("User-Agent", properties.userAgent())
            .header("Accept", "text/html,application/xhtml+xml")
            .GET()
            .build();

    HttpResponse<String> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    checkStatus(uri, response.statusCode());
    return response.body();
  }

  private FetchedAudio attemptDownload(URI uri) throws IOException, InterruptedException {
    HttpRequest request =
        HttpRequest.newBuilder(uri)
            .timeout(Duration.ofSeconds(properties.downloadTimeout()))
            .header("User-Agent", properties.userAgent())
            .GET()
            .build();

    HttpResponse<InputStream> response =
        httpClient.send(request, HttpResponse.BodyHandlers.ofInputStream());

    try (InputStream body = response.body()) {
      checkStatus(uri, response.statusCode());

      OptionalLong declared = response.headers().firstValueAsLong("Content-Length");
      if (declared.isPresent() && declared.getAsLong() > properties.maxAudioBytes()) {
        throw new FetchException(
            String.format(
                "Audio too large: %d bytes (max: %d bytes)",
                declared.getAsLong(), properties.maxAudioBytes()));
      }

      byte[] bytes = readLimited(body, properties.maxAudioBytes());
      if (bytes.length == 0) {
        throw new FetchException("Audio download was empty: " + uri);
      }

      String filename = filenameOf(uri);
      String contentType =
          response.headers().firstValue("Content-Type").orElseGet(() -> guessContentType(filename));
      LOGGER.info("Downloaded audio: url={}, bytes={}", uri, bytes.length);
      return new FetchedAudio(filename, contentType, bytes);
    }
  }

  /**
   * Run an attempt with retries. IO failures (timeouts included) and 5xx answers are retried;
   * {@link FetchException}s thrown by the attempt are final.
   */
  private <T> T withRetries(String description, Attempt<T> attempt) {
    int tries = 0;
    IOException lastException = null;

    while (tries < properties.maxRetries()) {
      try {
        return attempt.run();
      } catch (IOException e) {
        lastException = e;
        tries++;
        if (tries < properties.maxRetries()) {
          long backoffMs =
              (long)
                  (Math.pow(2, tries - 1) * properties.retryBackoffMs()
                      + Math.random() * properties.retryBackoffMs());
          LOGGER.warn(
              "Fetch of {} failed (attempt {}/{}), retrying in {}ms: {}",
              description,
              tries,
              properties.maxRetries(),
              backoffMs,
              e.getMessage());
          sleep(backoffMs);
        }
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        throw new FetchException("Fetch interrupted: " + description, e);
      }
    }

    throw new FetchException(
        String.format(
            "Fetch of %s failed after %d attempts: %s",
            description, properties.maxRetries(), lastException.getMessage()),
        lastException);
  }

  private static void checkStatus(URI uri, int statusCode) throws IOException {
    if (statusCode >= 500) {
      throw new IOException(String.format("Server returned status %d for %s", statusCode, uri));
    }
    if (statusCode >= 400) {
      throw new FetchException(String.format("Server returned status %d for %s", statusCode, uri));
    }
  }

  private static byte[] readLimited(InputStream in, long maxBytes) throws IOException {
    ByteArrayOutputStream out = new ByteArrayOutputStream();
    byte[] buffer = new byte[64 * 1024];
    long total = 0;
    int read;
    while ((read = in.read(buffer)) != -1) {
      total += read;
      if (total > maxBytes) {
        throw new FetchException(
            String.format("Audio too large: more than %d bytes", maxBytes));
      }
      out.write(buffer, 0, read);
    }
    return out.toByteArray();
  }

  private static URI parseUrl(String sourceUrl) {
    try {
      return URI.create(sourceUrl);
    } catch (IllegalArgumentException e) {
      throw new FetchException("Malformed source URL: " + sourceUrl, e);
    }
  }

  static String filenameOf(URI uri) {
    String path = uri.getRawPath();
    if (path == null || path.isEmpty() || path.endsWith("/")) {
      return "audio.mp3";
    }
    String last = path.substring(path.lastIndexOf('/') + 1);
    return URLDecoder.decode(last, StandardCharsets.UTF_8);
  }

  static String guessContentType(String filename) {
    String lower = filename.toLowerCase(Locale.ROOT);
    if (lower.endsWith(".wav")) {
      return "audio/wav";
    }
    if (lower.endsWith(".m4a")) {
      return "audio/mp4";
    }
    if (lower.endsWith(".ogg")) {
      return "audio/ogg";
    }
    if (lower.endsWith(".aac")) {
      return "audio/aac";
    }
    return "audio/mpeg";
  }

  private static void sleep(long millis) {
    try {
      Thread.sleep(millis);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new FetchException("Fetch interrupted during backoff", e);
    }
  }

  @FunctionalInterface
  private interface Attempt<T> {
    T run() throws IOException, InterruptedException;
  }
}
