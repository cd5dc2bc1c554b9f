package com.scholary.songscraper.job;

/**
 * One song to scrape, as submitted.
 *
 * @param event optional event or category label, may be null
 */
public record SongRequest(String title, String artist, String url, String event) {}
