package ca.gc.cra.qaops.config;

import ca.gc.cra.qaops.application.rules.IgnoreRule;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Configuration of one product: its environments, ordered ignore rules and optional on-call definition.
 *
 * @param name product name as written in the configuration
 * @param environments environments keyed by name, in configuration order
 * @param ignoreRules ignore rules in evaluation order
 * @param onCall on-call definition; {@code null} when the product has none
 * @since 0.1.0
 */
public record ProductConfig(
    String name,
    Map<String, EnvironmentConfig> environments,
    List<IgnoreRule> ignoreRules,
    OnCallConfig onCall) {

  public ProductConfig {
    Objects.requireNonNull(name, "name");
    environments = environments == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(environments));
    ignoreRules = ignoreRules == null ? List.of() : List.copyOf(ignoreRules);
  }

  public Optional<EnvironmentConfig> environment(String environment) {
    return Optional.ofNullable(environments.get(environment));
  }

  /**
   * @param environment environment name
   * @return channel of that environment
   * @throws ConfigurationException when the product does not define the environment
   */
  public String channelReference(String environment) {
    return environment(environment)
        .map(EnvironmentConfig::channelReference)
        .orElseThrow(() -> new ConfigurationException(
            "Environment '" + environment + "' is not configured for product " + name
                + ". Available: " + environmentNames()));
  }

  public List<String> environmentNames() {
    return new ArrayList<>(environments.keySet());
  }

  public Optional<OnCallConfig> onCallConfig() {
    return Optional.ofNullable(onCall);
  }

  /**
   * @param alarmName alarm name
   * @return {@code true} when an on-call pattern is configured and matches the name
   */
  public boolean isOnCallAlarm(String alarmName) {
    return onCall != null && onCall.isOnCallAlarm(alarmName);
  }

  /**
   * @param environment environment under analysis
   * @return rules scoped to every environment or to {@code environment}, in declaration order
   */
  public List<IgnoreRule> applicableIgnoreRules(String environment) {
    return ignoreRules.stream().filter(rule -> rule.appliesToEnvironment(environment)).toList();
  }
}
