package com.scholary.songscraper.api;

import com.scholary.songscraper.job.SongRequest;
import jakarta.validation.constraints.NotBlank;

/** One song in a job submission. */
public record SongSubmission(
    @NotBlank String title, @NotBlank String artist, @NotBlank String url, String event) {

  public SongRequest toRequest() {
    return new SongRequest(title, artist, url, event);
  }
}
