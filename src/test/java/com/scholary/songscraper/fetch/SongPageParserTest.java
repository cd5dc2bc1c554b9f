package com.scholary.songscraper.fetch;

import static org.assertj.core.api.Assertions.assertThat;

import java.net.URI;
import org.junit.jupiter.api.Test;

class SongPageParserTest {

  private static final URI PAGE = URI.create("https://songs.example.com/praise-night-20/song/");

  private final SongPageParser parser = new SongPageParser();

  @Test
  void extractLyrics_shouldJoinParagraphsAndKeepLineBreaks() {
    String html =
        "<html><body><div class=\"post entry-content clearfix\">"
            + "<p>Verse one line one<br>Verse one   line two<br/></p>"
            + "<div class=\"ad\"><p>Inside nested block</p></div>"
            + "<p>Chorus &amp; more<br />\n  Sing it</p>"
            + "<p>Download Mp3 here</p>"
            + "<p>Share this song</p>"
            + "</div><p>Footer text</p></body></html>";

    assertThat(parser.extractLyrics(html))
        .contains(
            "Verse one line one\nVerse one line two\n\nInside nested block\n\n"
                + "Chorus & more\nSing it");
  }

  @Test
  void extractLyrics_shouldReturnEmptyWithoutContentBlock() {
    assertThat(parser.extractLyrics("<html><p>No lyrics here</p></html>")).isEmpty();
    assertThat(parser.extractLyrics("<div class='entry-content'><p>Listen now</p></div>"))
        .isEmpty();
  }

  @Test
  void extractLyrics_shouldDecodeNumericEntities() {
    String html = "<div class=\"entry-content\"><p>It&#8217;s &#x263A; here</p></div>";

    assertThat(parser.extractLyrics(html)).contains("It’s ☺ here");
  }

  @Test
  void extractLyrics_shouldKeepTextAroundOutOfRangeEntities() {
    String html =
        "<div class=\"entry-content\"><p>Great God&#x110000;</p>"
            + "<p>Mighty&#99999999999; King</p></div>";

    assertThat(parser.extractLyrics(html))
        .hasValueSatisfying(
            lyrics -> {
              assertThat(lyrics).startsWith("Great God");
              assertThat(lyrics).contains("\n\nMighty").endsWith("King");
            });
  }

  @Test
  void extractLyrics_shouldFindContentBlockWithUnquotedClass() {
    String html = "<div class=entry-content><p>Great God</p></div>";

    assertThat(parser.extractLyrics(html)).contains("Great God");
  }

  @Test
  void extractLyrics_shouldSplitUnclosedParagraphs() {
    String html = "<div class=\"entry-content\"><p>First verse<p>Second verse</div>";

    assertThat(parser.extractLyrics(html)).contains("First verse\n\nSecond verse");
  }

  @Test
  void extractLyrics_shouldPreferFullEntryContentBlock() {
    String html =
        "<div class=\"entry-content\"><p>Sidebar teaser</p></div>"
            + "<div class=\"entry-content entry clearfix\"><p>Real lyrics</p></div>";

    assertThat(parser.extractLyrics(html)).contains("Real lyrics");
  }

  @Test
  void extractAudioUrl_shouldPreferAudioTagSource() {
    String html =
        "<audio controls src=\"/wp-content/uploads/song.mp3\"></audio>"
            + "<a href=\"https://cdn.example.com/other.mp3\">Download</a>";

    assertThat(parser.extractAudioUrl(html, PAGE))
        .contains(URI.create("https://songs.example.com/wp-content/uploads/song.mp3"));
  }

  @Test
  void extractAudioUrl_shouldFallBackToNestedSourceThenLink() {
    String nested =
        "<audio controls><source src='https://cdn.example.com/a.m4a' type='audio/mp4'></audio>";
    String linked = "<p><a class=\"btn\" href=\"files/My Song.MP3\">Download</a></p>";

    assertThat(parser.extractAudioUrl(nested, PAGE))
        .contains(URI.create("https://cdn.example.com/a.m4a"));
    assertThat(parser.extractAudioUrl(linked, PAGE))
        .contains(URI.create("https://songs.example.com/praise-night-20/song/files/My%20Song.MP3"));
  }

  @Test
  void extractAudioUrl_shouldEncodeCharactersIllegalInUris() {
    String html = "<audio src=\"/wp-content/a|b.mp3\"></audio>";

    assertThat(parser.extractAudioUrl(html, PAGE))
        .contains(URI.create("https://songs.example.com/wp-content/a%7Cb.mp3"));
  }

  @Test
  void extractAudioUrl_shouldPreferAudioInsideFigure() {
    String html =
        "<audio src=\"https://cdn.example.com/preview.mp3\"></audio>"
            + "<figure class=\"wp-block-audio\"><audio src=\"/full.mp3\"></audio></figure>";

    assertThat(parser.extractAudioUrl(html, PAGE))
        .contains(URI.create("https://songs.example.com/full.mp3"));
  }

  @Test
  void extractAudioUrl_shouldReturnEmptyWithoutAudio() {
    assertThat(parser.extractAudioUrl("<a href=\"/about\">About</a>", PAGE)).isEmpty();
  }
}
