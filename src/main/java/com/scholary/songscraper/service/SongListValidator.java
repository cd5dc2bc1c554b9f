package com.scholary.songscraper.service;

import com.scholary.songscraper.config.ScraperProperties;
import com.scholary.songscraper.error.ValidationException;
import com.scholary.songscraper.job.SongRequest;
import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.springframework.stereotype.Component;

/**
 * Input checks for song lists and single song fields.
 *
 * <p>Everything is checked before any state is touched; the first problem found is reported.
 */
@Component
public class SongListValidator {

  static final int MAX_TITLE_LENGTH = 500;
  static final int MAX_ARTIST_LENGTH = 200;
  static final int MAX_EVENT_LENGTH = 200;

  private final int maxBatchSize;

  public SongListValidator(ScraperProperties properties) {
    this.maxBatchSize = properties.maxBatchSize();
  }

  public void validateBatch(List<SongRequest> songs) {
    if (songs == null || songs.isEmpty()) {
      throw new ValidationException("Song list must not be empty");
    }
    if (songs.size() > maxBatchSize) {
      throw new ValidationException(
          String.format("Too many songs: %d (max: %d)", songs.size(), maxBatchSize));
    }

    Set<String> urls = new HashSet<>();
    for (int i = 0; i < songs.size(); i++) {
      SongRequest song = songs.get(i);
      if (song == null) {
        throw new ValidationException(String.format("Song #%d is missing", i + 1));
      }
      try {
        validateTitle(song.title());
        validateArtist(song.artist());
        validateUrl(song.url());
        if (song.event() != null && !song.event().isBlank()) {
          validateEvent(song.event());
        }
      } catch (ValidationException e) {
        throw new ValidationException(String.format("Song #%d: %s", i + 1, e.getMessage()));
      }
      if (!urls.add(song.url().trim())) {
        throw new ValidationException(
            String.format("Song #%d: duplicate URL %s", i + 1, song.url().trim()));
      }
    }
  }

  public String validateTitle(String title) {
    return requireText("Title", title, MAX_TITLE_LENGTH);
  }

  public String validateArtist(String artist) {
    return requireText("Artist", artist, MAX_ARTIST_LENGTH);
  }

  public String validateEvent(String event) {
    return requireText("Event", event, MAX_EVENT_LENGTH);
  }

  /**
   * Accept absolute http(s) URLs with a host.
   *
   * @return the trimmed URL
   */
  public String validateUrl(String url) {
    if (url == null || url.isBlank()) {
      throw new ValidationException("URL must not be empty");
    }
    String trimmed = url.trim();
    try {
      URI uri = new URI(trimmed);
      String scheme = uri.getScheme();
      if (scheme == null
          || !(scheme.equalsIgnoreCase("http") || scheme.equalsIgnoreCase("https"))) {
        throw new ValidationException("URL must use http or https: " + trimmed);
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new ValidationException("URL has no host: " + trimmed);
      }
    } catch (URISyntaxException e) {
      throw new ValidationException("Malformed URL: " + trimmed);
    }
    return trimmed;
  }

  private static String requireText(String field, String value, int maxLength) {
    if (value == null || value.isBlank()) {
      throw new ValidationException(field + " must not be empty");
    }
    String trimmed = value.trim();
    if (trimmed.length() > maxLength) {
      throw new ValidationException(
          String.format(
              "%s too long: %d characters (max: %d)", field, trimmed.length(), maxLength));
    }
    return trimmed;
  }
}
