package com.scholary.songscraper.job;

import java.util.Objects;

/**
 * A song within a job and the artifacts produced for it.
 *
 * <p>Each artifact is attached at most once, by the worker that processes the song. Afterwards only
 * the storage sweeper touches the song, to drop references to blobs it deleted.
 */
public class SongItem {

  private final int index;
  private final String title;
  private final String artist;
  private final String url;
  private final String event;

  private boolean hasLyrics;
  private boolean hasAudio;
  private String lyricsBlobKey;
  private String audioBlobKey;
  private String audioFilename;
  private long audioSizeBytes;

  public SongItem(int index, SongRequest request) {
    this.index = index;
    this.title = request.title();
    this.artist = request.artist();
    this.url = request.url();
    this.event = request.event();
  }

  public synchronized void attachLyrics(String blobKey) {
    if (hasLyrics) {
      throw new IllegalStateException("Lyrics already attached: " + title);
    }
    this.hasLyrics = true;
    this.lyricsBlobKey = blobKey;
  }

  public synchronized void attachAudio(String blobKey, String filename, long sizeBytes) {
    if (hasAudio) {
      throw new IllegalStateException("Audio already attached: " + title);
    }
    this.hasAudio = true;
    this.audioBlobKey = blobKey;
    this.audioFilename = filename;
    this.audioSizeBytes = sizeBytes;
  }

  /**
   * Drop the reference to a deleted blob.
   *
   * @return true if this song referenced the key
   */
  public synchronized boolean releaseBlob(String blobKey) {
    if (Objects.equals(blobKey, lyricsBlobKey)) {
      lyricsBlobKey = null;
      return true;
    }
    if (Objects.equals(blobKey, audioBlobKey)) {
      audioBlobKey = null;
      return true;
    }
    return false;
  }

  public synchronized SongSnapshot snapshot() {
    return new SongSnapshot(
        index,
        title,
        artist,
        url,
        event,
        hasLyrics,
        hasAudio,
        lyricsBlobKey,
        audioBlobKey,
        audioFilename,
        audioSizeBytes);
  }

  public int getIndex() {
    return index;
  }

  public String getTitle() {
    return title;
  }

  public String getArtist() {
    return artist;
  }

  public String getUrl() {
    return url;
  }

  public String getEvent() {
    return event;
  }
}
