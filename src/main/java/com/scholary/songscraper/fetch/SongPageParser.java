package com.scholary.songscraper.fetch;

import java.net.URI;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Extracts lyrics and the audio link from a song page.
 *
 * <p>Lyrics live in the paragraphs of the {@code entry-content} block, with {@code <br>} as line
 * breaks. Promotional paragraphs (Download..., Listen..., Share...) are dropped. The audio link is
 * taken from an {@code <audio src>} inside a figure, the first {@code <audio>} on the page (its
 * {@code src} or a nested {@code <source src>}), or a plain link to an audio file, in that order.
 */
public class SongPageParser {

  private static final Logger LOGGER = LoggerFactory.getLogger(SongPageParser.class);

  private static final Pattern WHITESPACE = Pattern.compile("[ \\t\\r\\n\\f]+");
  private static final List<String> SKIPPED_PREFIXES = List.of("Download", "Listen", "Share");
  private static final String URI_CHARS =
      "abcdefghijklmnopqrstuvwxyzABCDEFGHIJKLMNOPQRSTUVWXYZ0123456789-._~:/?#@!$&'()*+,;=%";

  /** Lyrics text, or empty if the page has no lyrics block or the block has no usable text. */
  public Optional<String> extractLyrics(String html) {
    Document page = Jsoup.parse(html);
    Element content = page.selectFirst("div.entry-content.entry.clearfix");
    if (content == null) {
      content = page.selectFirst("div.entry-content");
    }
    if (content == null) {
      return Optional.empty();
    }

    List<String> sections = new ArrayList<>();
    for (Element paragraph : content.select("p")) {
      String text = paragraphText(paragraph);
      if (!text.isEmpty() && SKIPPED_PREFIXES.stream().noneMatch(text::startsWith)) {
        sections.add(text);
      }
    }
    return sections.isEmpty() ? Optional.empty() : Optional.of(String.join("\n\n", sections));
  }

  /** Absolute audio URL, resolved against the page URL, or empty if the page links no audio. */
  public Optional<URI> extractAudioUrl(String html, URI pageUrl) {
    Document page = Jsoup.parse(html, pageUrl.toString());

    Element figureAudio = page.selectFirst("figure audio[src]");
    if (figureAudio != null && !figureAudio.attr("src").isBlank()) {
      return toUri(figureAudio.absUrl("src"));
    }
    Element audio = page.selectFirst("audio");
    if (audio != null) {
      if (!audio.attr("src").isBlank()) {
        return toUri(audio.absUrl("src"));
      }
      Element source = audio.selectFirst("source[src]");
      if (source != null && !source.attr("src").isBlank()) {
        return toUri(source.absUrl("src"));
      }
    }
    Element link = page.selectFirst("a[href~=(?i)\\.(mp3|wav|m4a)$]");
    return link == null ? Optional.empty() : toUri(link.absUrl("href"));
  }

  private static String paragraphText(Element paragraph) {
    StringBuilder raw = new StringBuilder();
    NodeTraversor.traverse(
        (node, depth) -> {
          if (node instanceof TextNode) {
            raw.append(WHITESPACE.matcher(((TextNode) node).getWholeText()).replaceAll(" "));
          } else if (node instanceof Element && ((Element) node).normalName().equals("br")) {
            raw.append('\n');
          }
        },
        paragraph);

    StringBuilder lines = new StringBuilder();
    for (String line : raw.toString().split("\n", -1)) {
      if (lines.length() > 0) {
        lines.append('\n');
      }
      lines.append(line.strip());
    }
    return lines.toString().strip();
  }

  private static Optional<URI> toUri(String absoluteUrl) {
    if (absoluteUrl.isBlank()) {
      return Optional.empty();
    }
    try {
      return Optional.of(new URI(encodeIllegalChars(absoluteUrl.strip())));
    } catch (URISyntaxException e) {
      LOGGER.debug("Ignoring malformed audio link {}: {}", absoluteUrl, e.getMessage());
      return Optional.empty();
    }
  }

  /** Percent-encodes every character a URI may not carry literally (spaces, pipes, non-ASCII). */
  static String encodeIllegalChars(String url) {
    StringBuilder out = new StringBuilder(url.length());
    for (int i = 0; i < url.length(); i++) {
      char c = url.charAt(i);
      if (URI_CHARS.indexOf(c) >= 0) {
        out.append(c);
        continue;
      }
      int end = Character.isHighSurrogate(c) && i + 1 < url.length() ? i + 2 : i + 1;
      for (byte b : url.substring(i, end).getBytes(StandardCharsets.UTF_8)) {
        out.append('%').append(String.format("%02X", b & 0xFF));
      }
      i = end - 1;
    }
    return out.toString();
  }
}
