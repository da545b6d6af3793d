package ca.gc.cra.qaops.application.rules;

import ca.gc.cra.qaops.domain.time.TimeConstraint;
import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> One declarative filter removing matching alarms from analyzable statistics.
 * <p><strong>Matching:</strong> The pattern is a case-insensitive substring; {@value #ENV_PLACEHOLDER} is
 * replaced by the environment under analysis before searching.</p>
 * <p><strong>Time scope:</strong> A rule is active when {@code validity} is empty or matches, and
 * {@code exclusions} is empty or does not match. Rules carrying any time constraint are inactive for alarms
 * whose timestamp is unknown.</p>
 *
 * @param pattern substring to look for; never blank
 * @param path field path searched
 * @param environments environments the rule applies to; empty means all
 * @param reason optional operator-facing explanation; may be {@code null}
 * @param validity when the rule is active
 * @param exclusions when the rule is explicitly inactive
 * @since 0.1.0
 */
public record IgnoreRule(
    String pattern,
    RulePath path,
    List<String> environments,
    String reason,
    TimeConstraint validity,
    TimeConstraint exclusions) {
  /** Token replaced by the environment name inside patterns. */
  public static final String ENV_PLACEHOLDER = "[#env#]";

  public IgnoreRule {
    Objects.requireNonNull(pattern, "pattern");
    if (pattern.isBlank()) {
      throw new IllegalArgumentException("ignore rule pattern must not be blank");
    }
    path = path == null ? RulePath.ALL : path;
    environments = environments == null ? List.of() : List.copyOf(environments);
    reason = reason == null || reason.isBlank() ? null : reason;
    validity = validity == null ? TimeConstraint.empty() : validity;
    exclusions = exclusions == null ? TimeConstraint.empty() : exclusions;
  }

  /**
   * Creates an always-valid rule for every environment.
   *
   * @param pattern substring to look for
   * @param path dotted path, see {@link RulePath#parse(String)}
   * @return new rule
   */
  public static IgnoreRule of(String pattern, String path) {
    return new IgnoreRule(pattern, RulePath.parse(path), List.of(), null, null, null);
  }

  /**
   * @param environment environment under analysis
   * @return {@code true} when no environments are listed or {@code environment} is one of them
   */
  public boolean appliesToEnvironment(String environment) {
    return environments.isEmpty() || environments.contains(environment);
  }

  /**
   * @param environment environment under analysis; {@code null} leaves the pattern untouched
   * @return pattern with {@value #ENV_PLACEHOLDER} substituted
   */
  public String expandPattern(String environment) {
    return environment == null ? pattern : pattern.replace(ENV_PLACEHOLDER, environment);
  }

  public boolean hasTimeConstraints() {
    return !validity.isEmpty() || !exclusions.isEmpty();
  }

  /**
   * @param localTime alarm time in the analyzer's reference zone; {@code null} when unknown
   * @return {@code true} when the rule is active at {@code localTime}
   */
  public boolean isValidAt(LocalDateTime localTime) {
    if (!hasTimeConstraints()) {
      return true;
    }
    if (localTime == null) {
      return false;
    }
    if (!validity.isEmpty() && !validity.matches(localTime)) {
      return false;
    }
    return exclusions.isEmpty() || !exclusions.matches(localTime);
  }

  /**
   * @return configured reason, or a description of the pattern and path
   */
  public String describeReason() {
    if (reason != null) {
      return reason;
    }
    if (path.kind() == RulePath.Kind.ALL_FIELDS) {
      return "Pattern '" + pattern + "' found (wildcard search)";
    }
    return "Pattern '" + pattern + "' found in " + path;
  }
}
