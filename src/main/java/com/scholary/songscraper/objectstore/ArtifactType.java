package com.scholary.songscraper.objectstore;

import java.util.Arrays;
import java.util.Optional;

/** Kinds of stored artifact, each with its own folder under the job prefix. */
public enum ArtifactType {
  LYRICS("lyrics"),
  AUDIO("audio"),
  BUNDLE("archives");

  private final String folder;

  ArtifactType(String folder) {
    this.folder = folder;
  }

  public String folder() {
    return folder;
  }

  public static Optional<ArtifactType> fromFolder(String folder) {
    return Arrays.stream(values()).filter(t -> t.folder.equals(folder)).findFirst();
  }
}
