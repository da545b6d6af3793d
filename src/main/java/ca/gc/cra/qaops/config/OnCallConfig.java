package ca.gc.cra.qaops.config;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * On-call alarm definition: the channel urgent alarms are posted to and the pattern identifying them by name.
 *
 * @since 0.1.0
 */
public final class OnCallConfig {
  private final String channelReference;
  private final Pattern pattern;

  /**
   * @param channelReference channel identifier of on-call alarms
   * @param pattern regular expression searched case-insensitively in alarm names
   * @throws java.util.regex.PatternSyntaxException when the pattern is invalid
   */
  public OnCallConfig(String channelReference, String pattern) {
    this.channelReference = Objects.requireNonNull(channelReference, "channelReference").trim();
    this.pattern = Pattern.compile(Objects.requireNonNull(pattern, "pattern"), Pattern.CASE_INSENSITIVE);
  }

  public String channelReference() {
    return channelReference;
  }

  public String pattern() {
    return pattern.pattern();
  }

  /**
   * @param alarmName alarm name; {@code null} or blank never matches
   * @return {@code true} when the pattern is found in the name
   */
  public boolean isOnCallAlarm(String alarmName) {
    return alarmName != null && !alarmName.isBlank() && pattern.matcher(alarmName).find();
  }

  @Override
  public boolean equals(Object other) {
    return other instanceof OnCallConfig that
        && channelReference.equals(that.channelReference)
        && pattern().equals(that.pattern());
  }

  @Override
  public int hashCode() {
    return Objects.hash(channelReference, pattern());
  }

  @Override
  public String toString() {
    return "OnCallConfig(channel=" + channelReference + ", pattern=" + pattern() + ")";
  }
}
