package com.scholary.songscraper.worker;

import com.scholary.songscraper.fetch.FetchException;
import com.scholary.songscraper.fetch.FetchedAudio;
import com.scholary.songscraper.fetch.SongFetcher;
import com.scholary.songscraper.job.ScrapeJob;
import com.scholary.songscraper.job.SongItem;
import com.scholary.songscraper.logging.StructuredLogger;
import com.scholary.songscraper.notification.ProgressPublisher;
import com.scholary.songscraper.objectstore.ArtifactType;
import com.scholary.songscraper.objectstore.BlobPaths;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreException;
import com.scholary.songscraper.progress.Outcome;
import com.scholary.songscraper.progress.Phase;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Processes a single song: fetch and store the lyrics, then fetch and store the audio.
 *
 * <p>The two artifacts fail independently. A failed artifact is logged and counted as a failure
 * in its phase; the song only counts as failed for the job when neither artifact was obtained.
 * Nothing thrown by the fetcher or the object store escapes this class.
 */
@Component
public class SongProcessor {

  private static final Logger LOGGER = LoggerFactory.getLogger(SongProcessor.class);
  private static final String RULE = "=".repeat(60);

  private final SongFetcher fetcher;
  private final ObjectStoreClient objectStore;
  private final ProgressPublisher progress;
  private final Clock clock;
  private final StructuredLogger structuredLogger;

  public SongProcessor(
      SongFetcher fetcher, ObjectStoreClient objectStore, ProgressPublisher progress, Clock clock) {
    this.fetcher = fetcher;
    this.objectStore = objectStore;
    this.progress = progress;
    this.clock = clock;
    this.structuredLogger = new StructuredLogger(LOGGER);
  }

  public void process(ScrapeJob job, SongItem song) {
    String jobId = job.getJobId();
    long startTime = System.currentTimeMillis();
    structuredLogger.logSongStarted(jobId, song.getTitle(), song.getUrl());

    List<String> problems = new ArrayList<>(2);
    boolean gotLyrics = fetchLyrics(jobId, song, problems);
    boolean gotAudio = fetchAudio(jobId, song, problems);

    String failureReason = problems.isEmpty() ? null : String.join("; ", problems);
    job.recordSongOutcome(song, gotLyrics, gotAudio, failureReason, clock.instant());

    structuredLogger.logSongFinished(
        jobId, song.getTitle(), gotLyrics, gotAudio, System.currentTimeMillis() - startTime);
  }

  private boolean fetchLyrics(String jobId, SongItem song, List<String> problems) {
    try {
      String lyrics = fetcher.fetchLyrics(song.getUrl());
      byte[] document = lyricsDocument(song, lyrics).getBytes(StandardCharsets.UTF_8);
      String key = BlobPaths.key(jobId, ArtifactType.LYRICS, baseName(song) + ".txt");

      objectStore.putObject(
          key, new ByteArrayInputStream(document), document.length, "text/plain; charset=utf-8");
      song.attachLyrics(key);

      progress.record(jobId, Phase.LYRICS, Outcome.SUCCESS, song.getTitle());
      return true;
    } catch (FetchException | ObjectStoreException e) {
      artifactFailed(jobId, song, Phase.LYRICS, e.getMessage(), problems);
      return false;
    } catch (RuntimeException e) {
      LOGGER.error(
          "Unexpected error fetching lyrics: jobId={}, title={}", jobId, song.getTitle(), e);
      artifactFailed(jobId, song, Phase.LYRICS, "Unexpected error: " + e.getMessage(), problems);
      return false;
    }
  }

  private boolean fetchAudio(String jobId, SongItem song, List<String> problems) {
    try {
      FetchedAudio audio = fetcher.fetchAudio(song.getUrl());
      String filename = baseName(song) + extensionOf(audio.filename());
      String key = BlobPaths.key(jobId, ArtifactType.AUDIO, filename);

      objectStore.putObject(
          key, new ByteArrayInputStream(audio.bytes()), audio.size(), audio.contentType());
      song.attachAudio(key, BlobPaths.sanitizeFilename(filename), audio.size());

      progress.record(jobId, Phase.AUDIO, Outcome.SUCCESS, song.getTitle());
      return true;
    } catch (FetchException | ObjectStoreException e) {
      artifactFailed(jobId, song, Phase.AUDIO, e.getMessage(), problems);
      return false;
    } catch (RuntimeException e) {
      LOGGER.error(
          "Unexpected error fetching audio: jobId={}, title={}", jobId, song.getTitle(), e);
      artifactFailed(jobId, song, Phase.AUDIO, "Unexpected error: " + e.getMessage(), problems);
      return false;
    }
  }

  private void artifactFailed(
      String jobId, SongItem song, Phase phase, String reason, List<String> problems) {
    structuredLogger.logArtifactFailed(jobId, song.getTitle(), phase.name(), reason);
    problems.add(phase.name().toLowerCase() + ": " + reason);
    progress.record(jobId, phase, Outcome.FAILURE, song.getTitle());
  }

  /**
   * Lyrics file content.
   *
   * <pre>
   * Title: ...
   * Artist: ...
   * Source: ...
   * ============================================================
   *
   * lyrics
   * </pre>
   */
  static String lyricsDocument(SongItem song, String lyrics) {
    return "Title: "
        + song.getTitle()
        + "\nArtist: "
        + song.getArtist()
        + "\nSource: "
        + song.getUrl()
        + "\n"
        + RULE
        + "\n\n"
        + lyrics;
  }

  /** Position prefix keeps file names unique within a job when titles repeat. */
  static String baseName(SongItem song) {
    return String.format("%02d %s - %s", song.getIndex() + 1, song.getTitle(), song.getArtist());
  }

  static String extensionOf(String filename) {
    if (filename != null) {
      int dot = filename.lastIndexOf('.');
      if (dot >= 0 && dot < filename.length() - 1 && filename.length() - dot <= 5) {
        return filename.substring(dot).toLowerCase();
      }
    }
    return ".mp3";
  }
}
