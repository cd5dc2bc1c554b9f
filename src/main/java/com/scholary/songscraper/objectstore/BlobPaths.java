package com.scholary.songscraper.objectstore;

import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Builds and parses blob keys of the form {@code {jobId}/{folder}/{filename}}.
 *
 * <p>The job prefix lets the sweeper and operators scan one job's artifacts with a single listing.
 */
public final class BlobPaths {

  private static final Pattern ILLEGAL_CHARS = Pattern.compile("[\\\\/*?:\"<>|]");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");
  private static final int MAX_FILENAME_LENGTH = 200;

  private BlobPaths() {}

  public static String key(String jobId, ArtifactType type, String filename) {
    return jobId + "/" + type.folder() + "/" + sanitizeFilename(filename);
  }

  public static String jobPrefix(String jobId) {
    return jobId + "/";
  }

  /** Remove characters that are illegal in file names, collapse whitespace, cap the length. */
  public static String sanitizeFilename(String name) {
    String sanitized = ILLEGAL_CHARS.matcher(name).replaceAll("").trim();
    sanitized = WHITESPACE.matcher(sanitized).replaceAll(" ");
    if (sanitized.length() > MAX_FILENAME_LENGTH) {
      sanitized = sanitized.substring(0, MAX_FILENAME_LENGTH).trim();
    }
    return sanitized.isEmpty() ? "untitled" : sanitized;
  }

  /** Parse a key back into its parts, or empty if it does not follow the convention. */
  public static Optional<ParsedKey> parse(String key) {
    String[] parts = key.split("/", 3);
    if (parts.length != 3 || parts[0].isEmpty() || parts[2].isEmpty()) {
      return Optional.empty();
    }
    return ArtifactType.fromFolder(parts[1]).map(type -> new ParsedKey(parts[0], type, parts[2]));
  }

  public record ParsedKey(String jobId, ArtifactType type, String filename) {}
}
