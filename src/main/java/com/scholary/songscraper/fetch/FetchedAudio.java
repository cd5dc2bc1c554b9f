package com.scholary.songscraper.fetch;

/** Downloaded audio content. */
public record FetchedAudio(String filename, String contentType, byte[] bytes) {

  public long size() {
    return bytes.length;
  }
}
