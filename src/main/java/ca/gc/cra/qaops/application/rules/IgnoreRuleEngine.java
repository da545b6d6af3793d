package ca.gc.cra.qaops.application.rules;

import ca.gc.cra.qaops.domain.event.RawEvent;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneId;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Evaluates an ordered list of {@link IgnoreRule}s against raw events.
 * <p><strong>Semantics:</strong> Rules are scanned in declaration order. A rule decides when it applies to the
 * environment, its expanded pattern occurs in one of the values addressed by its path, and it is time-valid at
 * the alarm's local time. The first such rule supplies the reason.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe to share across alarm types.</p>
 *
 * @since 0.1.0
 */
public final class IgnoreRuleEngine {
  private static final Logger log = LoggerFactory.getLogger(IgnoreRuleEngine.class);

  private final List<IgnoreRule> rules;
  private final ZoneId zone;

  /**
   * @param rules rules in evaluation order
   * @param zone zone in which validity and exclusion constraints are evaluated
   */
  public IgnoreRuleEngine(List<IgnoreRule> rules, ZoneId zone) {
    this.rules = List.copyOf(Objects.requireNonNull(rules, "rules"));
    this.zone = Objects.requireNonNull(zone, "zone");
  }

  /**
   * Evaluates every rule against {@code event}.
   *
   * @param event raw event
   * @param environment environment under analysis; {@code null} applies every rule without placeholder expansion
   * @param timestamp alarm instant; {@code null} deactivates rules with time constraints
   * @return decision with the first active matching rule
   */
  public IgnoreDecision evaluate(RawEvent event, String environment, Instant timestamp) {
    Objects.requireNonNull(event, "event");
    LocalDateTime localTime = timestamp == null ? null : LocalDateTime.ofInstant(timestamp, zone);
    for (IgnoreRule rule : rules) {
      if (!structurallyMatches(rule, event, environment)) {
        continue;
      }
      if (!rule.isValidAt(localTime)) {
        log.debug("Rule {} matched but is not active at {}", rule.pattern(), localTime);
        continue;
      }
      return IgnoreDecision.ignoredBy(rule);
    }
    return IgnoreDecision.NOT_IGNORED;
  }

  public boolean shouldIgnore(RawEvent event, String environment, Instant timestamp) {
    return evaluate(event, environment, timestamp).ignored();
  }

  /**
   * @return reason of the first active matching rule, or empty when the event is kept
   */
  public Optional<String> ignoreReason(RawEvent event, String environment, Instant timestamp) {
    return Optional.ofNullable(evaluate(event, environment, timestamp).reason());
  }

  public Optional<IgnoreRule> matchedRule(RawEvent event, String environment, Instant timestamp) {
    return evaluate(event, environment, timestamp).matchedRule();
  }

  private static boolean structurallyMatches(IgnoreRule rule, RawEvent event, String environment) {
    if (environment != null && !rule.appliesToEnvironment(environment)) {
      return false;
    }
    String needle = rule.expandPattern(environment).toLowerCase(Locale.ROOT);
    for (String value : rule.path().values(event)) {
      if (value.toLowerCase(Locale.ROOT).contains(needle)) {
        return true;
      }
    }
    return false;
  }
}
