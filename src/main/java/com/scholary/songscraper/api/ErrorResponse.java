package com.scholary.songscraper.api;

import java.time.Instant;

/** Error body returned for every rejected request. */
public record ErrorResponse(int status, String error, String message, Instant timestamp) {}
