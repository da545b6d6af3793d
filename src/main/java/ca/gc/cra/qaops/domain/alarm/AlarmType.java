package ca.gc.cra.qaops.domain.alarm;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Named classification of alarms for one product, environment and category.
 * <p><strong>Why:</strong> Each type reads its own channel with its own window policy and keeps its own counters.</p>
 * <p><strong>Semantics:</strong> {@link #matches(String)} performs a case-insensitive search, not an anchored
 * match, so patterns must carry their own anchors when needed.</p>
 * <p><strong>Thread-safety:</strong> Immutable; the compiled {@link Pattern} is safe to share.</p>
 *
 * @since 0.1.0
 */
public final class AlarmType {
  private final String product;
  private final String environment;
  private final AlarmCategory category;
  private final String channelReference;
  private final Pattern namePattern;
  private final String description;

  /**
   * Creates an alarm type, compiling {@code namePattern} case-insensitively.
   *
   * @param product product name
   * @param environment environment name
   * @param category normal or on-call
   * @param channelReference identifier of the channel the alarms are read from
   * @param namePattern regular expression over alarm names
   * @param description human readable label
   * @throws java.util.regex.PatternSyntaxException when {@code namePattern} is not a valid expression
   */
  public AlarmType(
      String product,
      String environment,
      AlarmCategory category,
      String channelReference,
      String namePattern,
      String description) {
    this.product = Objects.requireNonNull(product, "product");
    this.environment = Objects.requireNonNull(environment, "environment");
    this.category = Objects.requireNonNull(category, "category");
    this.channelReference = Objects.requireNonNull(channelReference, "channelReference");
    this.namePattern =
        Pattern.compile(Objects.requireNonNull(namePattern, "namePattern"), Pattern.CASE_INSENSITIVE);
    this.description = description == null ? "" : description;
  }

  /**
   * @param alarmName extracted alarm name; {@code null} or blank never matches
   * @return {@code true} when the pattern is found anywhere in the name
   */
  public boolean matches(String alarmName) {
    if (alarmName == null || alarmName.isBlank()) {
      return false;
    }
    return namePattern.matcher(alarmName).find();
  }

  public boolean isOnCall() {
    return category == AlarmCategory.ONCALL;
  }

  public boolean isNormal() {
    return category == AlarmCategory.NORMAL;
  }

  public String product() {
    return product;
  }

  public String environment() {
    return environment;
  }

  public AlarmCategory category() {
    return category;
  }

  public String channelReference() {
    return channelReference;
  }

  public String namePattern() {
    return namePattern.pattern();
  }

  public String description() {
    return description;
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof AlarmType that)) {
      return false;
    }
    return product.equals(that.product)
        && environment.equals(that.environment)
        && category == that.category
        && channelReference.equals(that.channelReference)
        && namePattern.pattern().equals(that.namePattern.pattern())
        && description.equals(that.description);
  }

  @Override
  public int hashCode() {
    return Objects.hash(product, environment, category, channelReference, namePattern.pattern(), description);
  }

  @Override
  public String toString() {
    return "AlarmType(" + product + "/" + environment + "/" + category.name().toLowerCase(Locale.ROOT) + ")";
  }
}
