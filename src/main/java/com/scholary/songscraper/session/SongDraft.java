package com.scholary.songscraper.session;

import com.scholary.songscraper.job.SongRequest;

/** The song being assembled; fields fill in one at a time. */
public record SongDraft(String title, String artist, String url, String event) {

  public static final SongDraft EMPTY = new SongDraft(null, null, null, null);

  public SongDraft withTitle(String value) {
    return new SongDraft(value, artist, url, event);
  }

  public SongDraft withArtist(String value) {
    return new SongDraft(title, value, url, event);
  }

  public SongDraft withUrl(String value, String detectedEvent) {
    return new SongDraft(title, artist, value, detectedEvent);
  }

  public SongDraft withEvent(String value) {
    return new SongDraft(title, artist, url, value);
  }

  public SongRequest toRequest() {
    return new SongRequest(title, artist, url, event);
  }
}
