package ca.gc.cra.qaops.domain.alarm;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed alarm opening line of the form {@code #<id>: ALARM: "<name>" in <location>}.
 *
 * @param id occurrence identifier
 * @param name alarm name between the quotes
 * @param location text after {@code in}
 * @since 0.1.0
 */
public record AlarmTitle(String id, String name, String location) {
  private static final Pattern OPENING = Pattern.compile("#(\\d+): ALARM: \"([^\"]+)\" in (.+)");

  /**
   * Searches {@code text} for an alarm opening line.
   *
   * @param text candidate text; may be {@code null}
   * @return parsed title, or empty when the text carries no opening line
   */
  public static Optional<AlarmTitle> parse(String text) {
    if (text == null || text.isEmpty()) {
      return Optional.empty();
    }
    Matcher matcher = OPENING.matcher(text);
    if (!matcher.find()) {
      return Optional.empty();
    }
    return Optional.of(new AlarmTitle(matcher.group(1), matcher.group(2), matcher.group(3).trim()));
  }
}
