package com.scholary.songscraper.worker;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.scholary.songscraper.fetch.FetchException;
import com.scholary.songscraper.fetch.FetchedAudio;
import com.scholary.songscraper.fetch.SongFetcher;
import com.scholary.songscraper.job.JobSnapshot;
import com.scholary.songscraper.job.ScrapeJob;
import com.scholary.songscraper.job.SongRequest;
import com.scholary.songscraper.job.SongSnapshot;
import com.scholary.songscraper.notification.ProgressPublisher;
import com.scholary.songscraper.objectstore.InMemoryObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreException;
import com.scholary.songscraper.progress.Phase;
import com.scholary.songscraper.progress.PhaseProgressView;
import com.scholary.songscraper.progress.ProgressTracker;
import com.scholary.songscraper.support.MutableClock;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.context.ApplicationEventPublisher;

@ExtendWith(MockitoExtension.class)
class SongProcessorTest {

  private static final String URL = "https://songs.example.com/praise-night-20/great-god";

  @Mock private SongFetcher fetcher;
  @Mock private ApplicationEventPublisher eventPublisher;

  private MutableClock clock;
  private InMemoryObjectStoreClient objectStore;
  private ProgressTracker tracker;
  private ScrapeJob job;

  @BeforeEach
  void setUp() {
    clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
    objectStore = new InMemoryObjectStoreClient("bucket", clock);
    tracker = new ProgressTracker(Duration.ofHours(1), clock);
    job =
        new ScrapeJob(
            "job-1",
            5L,
            List.of(new SongRequest("Great God", "Choir", URL, null)),
            clock.instant());
    tracker.open("job-1", Phase.LYRICS, 1);
    tracker.open("job-1", Phase.AUDIO, 1);
  }

  @Test
  void process_shouldStoreBothArtifacts() throws IOException {
    when(fetcher.fetchLyrics(URL)).thenReturn("Verse\nChorus");
    when(fetcher.fetchAudio(URL))
        .thenReturn(new FetchedAudio("great-god.MP3", "audio/mpeg", new byte[] {1, 2, 3}));

    processor(objectStore).process(job, job.getSongs().get(0));

    SongSnapshot song = job.snapshot().songs().get(0);
    assertThat(song.lyricsBlobKey()).isEqualTo("job-1/lyrics/01 Great God - Choir.txt");
    assertThat(song.audioBlobKey()).isEqualTo("job-1/audio/01 Great God - Choir.mp3");
    assertThat(song.audioSizeBytes()).isEqualTo(3);

    try (InputStream in = objectStore.getObjectStream(song.lyricsBlobKey())) {
      assertThat(new String(in.readAllBytes(), StandardCharsets.UTF_8))
          .isEqualTo(
              "Title: Great God\nArtist: Choir\nSource: "
                  + URL
                  + "\n"
                  + "=".repeat(60)
                  + "\n\nVerse\nChorus");
    }

    JobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.completedSongs()).isEqualTo(1);
    assertThat(snapshot.lyricsCompleted()).isEqualTo(1);
    assertThat(snapshot.audioCompleted()).isEqualTo(1);
    assertThat(phase(Phase.LYRICS).succeeded()).isEqualTo(1);
    assertThat(phase(Phase.AUDIO).percentage()).isEqualTo(100.0);
  }

  @Test
  void process_shouldCountLyricsOnlyAsCompleted() {
    when(fetcher.fetchLyrics(URL)).thenReturn("Verse");
    when(fetcher.fetchAudio(URL)).thenThrow(new FetchException("No audio link found on page"));

    processor(objectStore).process(job, job.getSongs().get(0));

    JobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.completedSongs()).isEqualTo(1);
    assertThat(snapshot.failedSongs()).isZero();
    assertThat(snapshot.songs().get(0).hasAudio()).isFalse();
    assertThat(phase(Phase.AUDIO).failed()).isEqualTo(1);
    assertThat(phase(Phase.AUDIO).current()).isEqualTo(1);
  }

  @Test
  void process_shouldFailSongWhenBothArtifactsFail() {
    when(fetcher.fetchLyrics(URL)).thenThrow(new FetchException("timeout"));
    when(fetcher.fetchAudio(URL)).thenThrow(new FetchException("timeout"));

    processor(objectStore).process(job, job.getSongs().get(0));

    JobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.completedSongs()).isZero();
    assertThat(snapshot.failedSongs()).isEqualTo(1);
    assertThat(objectStore.listObjects("")).isEmpty();
  }

  @Test
  void process_shouldTreatStorageFailureAsArtifactFailure() {
    ObjectStoreClient failingStore = mock(ObjectStoreClient.class);
    when(fetcher.fetchLyrics(URL)).thenReturn("Verse");
    when(fetcher.fetchAudio(URL))
        .thenReturn(new FetchedAudio("a.mp3", "audio/mpeg", new byte[] {1}));
    doThrow(new ObjectStoreException("bucket unavailable", null))
        .when(failingStore)
        .putObject(anyString(), any(InputStream.class), anyLong(), anyString());

    processor(failingStore).process(job, job.getSongs().get(0));

    JobSnapshot snapshot = job.snapshot();
    assertThat(snapshot.failedSongs()).isEqualTo(1);
    assertThat(snapshot.songs().get(0).hasLyrics()).isFalse();
    assertThat(phase(Phase.LYRICS).failed()).isEqualTo(1);
  }

  @Test
  void extensionOf_shouldDefaultToMp3() {
    assertThat(SongProcessor.extensionOf("track.WAV")).isEqualTo(".wav");
    assertThat(SongProcessor.extensionOf("track")).isEqualTo(".mp3");
    assertThat(SongProcessor.extensionOf("download.php?id=4")).isEqualTo(".mp3");
    assertThat(SongProcessor.extensionOf(null)).isEqualTo(".mp3");
  }

  private SongProcessor processor(ObjectStoreClient store) {
    return new SongProcessor(fetcher, store, new ProgressPublisher(tracker, eventPublisher), clock);
  }

  private PhaseProgressView phase(Phase phase) {
    return tracker.phase("job-1", phase).orElseThrow();
  }
}
