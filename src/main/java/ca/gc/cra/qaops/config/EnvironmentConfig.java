package ca.gc.cra.qaops.config;

import java.util.Objects;

/**
 * Environment of a product and the channel its alarms are posted to.
 *
 * @param name environment name, for example {@code prod}
 * @param channelReference channel identifier; may be blank when misconfigured
 * @since 0.1.0
 */
public record EnvironmentConfig(String name, String channelReference) {
  public EnvironmentConfig {
    Objects.requireNonNull(name, "name");
    channelReference = channelReference == null ? "" : channelReference.trim();
  }
}
