package com.scholary.songscraper.fetch;

/**
 * Fetches the artifacts of a song from its source page.
 *
 * <p>Each call yields one outcome: the artifact, or a {@link FetchException}. Retries, backoff and
 * timeouts toward the remote site are the implementation's responsibility; an expired timeout is
 * reported as an ordinary FetchException.
 */
public interface SongFetcher {

  /**
   * Fetch the lyrics text of a song.
   *
   * @param sourceUrl the song's page URL
   * @return the lyrics, never blank
   * @throws FetchException if the lyrics cannot be obtained
   */
  String fetchLyrics(String sourceUrl);

  /**
   * Fetch the audio file of a song.
   *
   * @param sourceUrl the song's page URL
   * @return the audio bytes with a suggested filename and content type
   * @throws FetchException if the audio cannot be obtained
   */
  FetchedAudio fetchAudio(String sourceUrl);
}
