package ca.gc.cra.qaops.application.rules;

import java.util.Optional;

/**
 * Result of evaluating the ignore rules for one event.
 *
 * @param ignored whether the event is removed from statistics
 * @param rule first rule that matched and was active; {@code null} when not ignored
 * @param reason reason of that rule; {@code null} when not ignored
 * @since 0.1.0
 */
public record IgnoreDecision(boolean ignored, IgnoreRule rule, String reason) {
  /** Decision for events no rule removes. */
  public static final IgnoreDecision NOT_IGNORED = new IgnoreDecision(false, null, null);

  public IgnoreDecision {
    if (ignored && rule == null) {
      throw new IllegalArgumentException("ignored decision requires the matching rule");
    }
  }

  static IgnoreDecision ignoredBy(IgnoreRule rule) {
    return new IgnoreDecision(true, rule, rule.describeReason());
  }

  public Optional<IgnoreRule> matchedRule() {
    return Optional.ofNullable(rule);
  }
}
