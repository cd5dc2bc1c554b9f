package com.scholary.songscraper.objectstore;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class BlobPathsTest {

  @Test
  void key_shouldFollowJobTypeFileLayout() {
    String jobId = "42_20260101_000000_ab12cd34";

    assertThat(BlobPaths.key(jobId, ArtifactType.AUDIO, "01 Song - Artist.mp3"))
        .isEqualTo(jobId + "/audio/01 Song - Artist.mp3");
    assertThat(BlobPaths.key("job", ArtifactType.BUNDLE, "job.zip"))
        .isEqualTo("job/archives/job.zip");
  }

  @Test
  void sanitizeFilename_shouldStripIllegalCharactersAndCollapseWhitespace() {
    assertThat(BlobPaths.sanitizeFilename("What/Is:  This?  <Song>*|\"\\"))
        .isEqualTo("WhatIs This Song");
    assertThat(BlobPaths.sanitizeFilename("  ")).isEqualTo("untitled");
    assertThat(BlobPaths.sanitizeFilename("a".repeat(250))).hasSize(200);
  }

  @Test
  void parse_shouldReadBackKeysAndRejectOthers() {
    BlobPaths.ParsedKey parsed = BlobPaths.parse("job-1/lyrics/01 A - B.txt").orElseThrow();

    assertThat(parsed.jobId()).isEqualTo("job-1");
    assertThat(parsed.type()).isEqualTo(ArtifactType.LYRICS);
    assertThat(parsed.filename()).isEqualTo("01 A - B.txt");

    assertThat(BlobPaths.parse("job-1/videos/a.mp4")).isEmpty();
    assertThat(BlobPaths.parse("loose-file.txt")).isEmpty();
    assertThat(BlobPaths.parse("job-1/audio/")).isEmpty();
  }
}
