package ca.gc.cra.qaops.config;

import ca.gc.cra.qaops.application.rules.IgnoreRule;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Reports configuration problems that do not prevent loading but make a product partially unusable.
 *
 * @since 0.1.0
 */
public final class ConfigValidator {

  /**
   * @param config loaded configuration
   * @return human readable problems; empty when the configuration is complete
   */
  public List<String> validate(AnalyzerConfig config) {
    Objects.requireNonNull(config, "config");
    List<String> problems = new ArrayList<>();
    if (config.products().isEmpty()) {
      problems.add("No products defined");
    }
    for (ProductConfig product : config.products().values()) {
      if (product.environments().isEmpty()) {
        problems.add("Product '" + product.name() + "' has no environments defined");
      }
      for (EnvironmentConfig env : product.environments().values()) {
        if (env.channelReference().isEmpty()) {
          problems.add("Product '" + product.name() + "', environment '" + env.name() + "' has empty slack_channel_id");
        }
      }
      product.onCallConfig().ifPresent(onCall -> {
        if (onCall.channelReference().isEmpty()) {
          problems.add("Product '" + product.name() + "' on-call definition has empty slack_channel_id");
        }
        if (!product.environments().containsKey("prod")) {
          problems.add("Product '" + product.name() + "' defines on-call alarms but no prod environment");
        }
      });
      List<IgnoreRule> rules = product.ignoreRules();
      for (int i = 0; i < rules.size(); i++) {
        for (String env : rules.get(i).environments()) {
          if (!product.environments().containsKey(env)) {
            problems.add("Product '" + product.name() + "', ignore rule " + (i + 1)
                + " references unknown environment '" + env + "'");
          }
        }
      }
    }
    return problems;
  }
}
