package com.scholary.songscraper.job;

/** Immutable view of a song's artifact state. */
public record SongSnapshot(
    int index,
    String title,
    String artist,
    String url,
    String event,
    boolean hasLyrics,
    boolean hasAudio,
    String lyricsBlobKey,
    String audioBlobKey,
    String audioFilename,
    long audioSizeBytes) {}
