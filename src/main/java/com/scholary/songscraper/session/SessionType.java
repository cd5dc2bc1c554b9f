package com.scholary.songscraper.session;

/** Kinds of interactive session. A user has at most one active session of each kind. */
public enum SessionType {
  ADD_SONG
}
