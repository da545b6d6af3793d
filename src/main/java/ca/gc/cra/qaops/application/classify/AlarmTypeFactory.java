package ca.gc.cra.qaops.application.classify;

import ca.gc.cra.qaops.application.extract.ProductEnvironment;
import ca.gc.cra.qaops.config.OnCallConfig;
import ca.gc.cra.qaops.config.ProductConfig;
import ca.gc.cra.qaops.domain.alarm.AlarmCategory;
import ca.gc.cra.qaops.domain.alarm.AlarmType;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Builds the alarm types analyzed for one product and environment.
 * <p><strong>Semantics:</strong>
 * <ul>
 *   <li>A {@code normal} type is always built on the environment's channel.</li>
 *   <li>When the product has an on-call pattern, the normal pattern is a negative lookahead over it so normal
 *       and on-call types never both match one alarm name. Without one, the normal pattern matches anything.</li>
 *   <li>An {@code oncall} type is built only for {@code prod}, on the on-call channel.</li>
 * </ul>
 *
 * @since 0.1.0
 */
public final class AlarmTypeFactory {
  static final String MATCH_ANY = ".*";

  /**
   * @param product product configuration
   * @param environment environment under analysis
   * @return normal type first, followed by the on-call type when applicable
   * @throws ca.gc.cra.qaops.config.ConfigurationException when the environment is not configured
   */
  public List<AlarmType> build(ProductConfig product, String environment) {
    Objects.requireNonNull(product, "product");
    Objects.requireNonNull(environment, "environment");
    Optional<OnCallConfig> onCall = product.onCallConfig();
    List<AlarmType> types = new ArrayList<>(2);
    types.add(new AlarmType(
        product.name(),
        environment,
        AlarmCategory.NORMAL,
        product.channelReference(environment),
        onCall.map(config -> excluding(config.pattern())).orElse(MATCH_ANY),
        product.name() + " " + environment + " alarms"));
    if (onCall.isPresent() && isProd(environment)) {
      types.add(new AlarmType(
          product.name(),
          environment,
          AlarmCategory.ONCALL,
          onCall.get().channelReference(),
          onCall.get().pattern(),
          product.name() + " " + environment + " on-call alarms"));
    }
    return List.copyOf(types);
  }

  /**
   * Composes a pattern that matches exactly the names in which {@code pattern} is not found.
   *
   * @param pattern on-call pattern, searched anywhere in the name
   * @return negative lookahead pattern
   */
  static String excluding(String pattern) {
    return "^(?!(?s:.*?)(?:" + pattern + "))";
  }

  private static boolean isProd(String environment) {
    return ProductEnvironment.PROD.equals(environment.trim().toLowerCase(Locale.ROOT));
  }
}
