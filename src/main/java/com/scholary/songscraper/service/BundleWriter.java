package com.scholary.songscraper.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.scholary.songscraper.config.ScraperProperties;
import com.scholary.songscraper.error.ArchivingException;
import com.scholary.songscraper.job.JobSnapshot;
import com.scholary.songscraper.job.SongSnapshot;
import com.scholary.songscraper.notification.ProgressPublisher;
import com.scholary.songscraper.objectstore.ArtifactType;
import com.scholary.songscraper.objectstore.BlobPaths;
import com.scholary.songscraper.objectstore.ObjectStoreClient;
import com.scholary.songscraper.objectstore.ObjectStoreException;
import com.scholary.songscraper.progress.Outcome;
import com.scholary.songscraper.progress.Phase;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.zip.ZipEntry;
import java.util.zip.ZipOutputStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Packs a job's stored artifacts into one ZIP bundle.
 *
 * <p>Layout:
 *
 * <pre>
 * lyrics/01 Title - Artist.txt
 * audio/01 Title - Artist.mp3
 * manifest.json
 * </pre>
 *
 * <p>The bundle is stored under {@code {jobId}/archives/{jobId}.zip}. Each packed artifact advances
 * the archiving phase by one.
 */
@Component
public class BundleWriter {

  private static final Logger LOGGER = LoggerFactory.getLogger(BundleWriter.class);

  private final ObjectStoreClient objectStore;
  private final ObjectMapper objectMapper;
  private final ProgressPublisher progress;
  private final ScraperProperties properties;

  public BundleWriter(
      ObjectStoreClient objectStore,
      ObjectMapper objectMapper,
      ProgressPublisher progress,
      ScraperProperties properties) {
    this.objectStore = objectStore;
    this.objectMapper = objectMapper;
    this.progress = progress;
    this.properties = properties;
  }

  /**
   * Build and upload the bundle.
   *
   * @throws ArchivingException if an artifact cannot be read or the bundle cannot be stored
   */
  public Bundle write(JobSnapshot job) {
    List<Entry> entries = entriesOf(job);
    progress.open(job.jobId(), Phase.ARCHIVING, entries.size());

    byte[] zip;
    try {
      zip = pack(job, entries);
    } catch (IOException e) {
      throw new ArchivingException("Failed to build bundle: " + e.getMessage(), e);
    } catch (ObjectStoreException e) {
      throw new ArchivingException("Failed to read artifact: " + e.getMessage(), e);
    }

    String key = BlobPaths.key(job.jobId(), ArtifactType.BUNDLE, job.jobId() + ".zip");
    try {
      objectStore.putObject(key, new ByteArrayInputStream(zip), zip.length, "application/zip");
      URL url = objectStore.presignGet(key, properties.downloadUrlTtl());
      LOGGER.info(
          "Bundle stored: jobId={}, key={}, entries={}, size={} bytes",
          job.jobId(),
          key,
          entries.size(),
          zip.length);
      return new Bundle(key, url.toString(), entries.size(), zip.length);
    } catch (ObjectStoreException e) {
      throw new ArchivingException("Failed to store bundle: " + e.getMessage(), e);
    }
  }

  private byte[] pack(JobSnapshot job, List<Entry> entries) throws IOException {
    ByteArrayOutputStream buffer = new ByteArrayOutputStream();
    try (ZipOutputStream zip = new ZipOutputStream(buffer)) {
      for (Entry entry : entries) {
        zip.putNextEntry(new ZipEntry(entry.path()));
        try (InputStream in = objectStore.getObjectStream(entry.blobKey())) {
          in.transferTo(zip);
        }
        zip.closeEntry();
        progress.record(job.jobId(), Phase.ARCHIVING, Outcome.SUCCESS, entry.path());
      }

      zip.putNextEntry(new ZipEntry("manifest.json"));
      zip.write(manifest(job));
      zip.closeEntry();
    }
    return buffer.toByteArray();
  }

  private static List<Entry> entriesOf(JobSnapshot job) {
    List<Entry> entries = new ArrayList<>();
    for (SongSnapshot song : job.songs()) {
      if (song.lyricsBlobKey() != null) {
        entries.add(new Entry("lyrics/" + filenameOf(song.lyricsBlobKey()), song.lyricsBlobKey()));
      }
      if (song.audioBlobKey() != null) {
        entries.add(new Entry("audio/" + filenameOf(song.audioBlobKey()), song.audioBlobKey()));
      }
    }
    return entries;
  }

  private byte[] manifest(JobSnapshot job) throws IOException {
    List<Map<String, Object>> songs = new ArrayList<>();
    for (SongSnapshot song : job.songs()) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("title", song.title());
      entry.put("artist", song.artist());
      entry.put("url", song.url());
      entry.put("event", song.event());
      entry.put("hasLyrics", song.hasLyrics());
      entry.put("hasAudio", song.hasAudio());
      entry.put(
          "lyricsFile",
          song.lyricsBlobKey() == null ? null : "lyrics/" + filenameOf(song.lyricsBlobKey()));
      entry.put(
          "audioFile",
          song.audioBlobKey() == null ? null : "audio/" + filenameOf(song.audioBlobKey()));
      songs.add(entry);
    }

    Map<String, Object> manifest = new LinkedHashMap<>();
    manifest.put("jobId", job.jobId());
    manifest.put("userId", job.userId());
    manifest.put("createdAt", job.createdAt().toString());
    manifest.put("totalSongs", job.totalSongs());
    manifest.put("completedSongs", job.completedSongs());
    manifest.put("failedSongs", job.failedSongs());
    manifest.put("songs", songs);

    return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(manifest);
  }

  private static String filenameOf(String blobKey) {
    return BlobPaths.parse(blobKey)
        .map(BlobPaths.ParsedKey::filename)
        .orElse(blobKey.substring(blobKey.lastIndexOf('/') + 1));
  }

  private record Entry(String path, String blobKey) {}

  /** A stored bundle and a time-limited link to it. */
  public record Bundle(String key, String url, int entries, long sizeBytes) {}
}
