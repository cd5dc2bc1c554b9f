package com.scholary.songscraper.api;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import java.util.List;

/**
 * Request to scrape a batch of songs.
 *
 * <p>The batch size limit and URL checks are applied by the job manager.
 */
public record SubmitJobRequest(
    @NotNull Long userId, @NotEmpty List<@Valid @NotNull SongSubmission> songs) {}
