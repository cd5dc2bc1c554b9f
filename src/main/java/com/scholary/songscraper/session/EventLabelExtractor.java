package com.scholary.songscraper.session;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.springframework.stereotype.Component;

/**
 * Derives an event label from a song page URL slug.
 *
 * <p>The first matching event pattern names the event, e.g. {@code praise-night-25} becomes
 * "Praise Night 25". A context pattern such as {@code with-pastor-chris} appends "with Pastor
 * Chris".
 */
@Component
public class EventLabelExtractor {

  private static final List<EventPattern> EVENTS =
      List.of(
          new EventPattern("praise-night-(\\d+)", "Praise Night %s"),
          new EventPattern("healing-streams-(\\d+)", "Healing Streams %s"),
          new EventPattern("communion-service", "Communion Service"),
          new EventPattern("global-thanksgiving", "Global Thanksgiving"),
          new EventPattern("royal-thanksgiving", "Royal Thanksgiving"),
          new EventPattern("ylws", "YLWS"),
          new EventPattern("hslhs-(\\d+)[:-](\\d+)", "HSLHS %s:%s"),
          new EventPattern("your-loveworld-specials", "Your LoveWorld Specials"),
          new EventPattern("night-of-bliss", "Night of Bliss"),
          new EventPattern("campus-ministry", "Campus Ministry"),
          new EventPattern("rhapsody-concert", "Rhapsody Concert"),
          new EventPattern("worship-night", "Worship Night"),
          new EventPattern("celebration-service", "Celebration Service"));

  private static final List<EventPattern> CONTEXTS =
      List.of(
          new EventPattern("with-pastor-chris", "with Pastor Chris"),
          new EventPattern("pastor-chris", "with Pastor Chris"),
          new EventPattern("pc-", "with Pastor Chris"));

  public Optional<String> extract(String url) {
    if (url == null) {
      return Optional.empty();
    }
    String lower = url.toLowerCase(Locale.ROOT);
    List<String> parts = new ArrayList<>(2);
    firstMatch(EVENTS, lower).ifPresent(parts::add);
    firstMatch(CONTEXTS, lower).ifPresent(parts::add);
    return parts.isEmpty() ? Optional.empty() : Optional.of(String.join(" ", parts));
  }

  private static Optional<String> firstMatch(List<EventPattern> patterns, String input) {
    for (EventPattern candidate : patterns) {
      Matcher matcher = candidate.pattern().matcher(input);
      if (matcher.find()) {
        Object[] groups = new Object[matcher.groupCount()];
        for (int i = 0; i < groups.length; i++) {
          groups[i] = matcher.group(i + 1);
        }
        return Optional.of(String.format(candidate.template(), groups));
      }
    }
    return Optional.empty();
  }

  private record EventPattern(Pattern pattern, String template) {
    EventPattern(String regex, String template) {
      this(Pattern.compile(regex), template);
    }
  }
}
