package ca.gc.cra.qaops.config;

import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Root analyzer configuration.
 *
 * @param zone reference zone for windows, time constraints and business hours
 * @param businessHours office hours used for on-call classification
 * @param products products keyed by name, in configuration order
 * @since 0.1.0
 */
public record AnalyzerConfig(ZoneId zone, BusinessHours businessHours, Map<String, ProductConfig> products) {
  /** Zone used when the configuration names none. */
  public static final ZoneId DEFAULT_ZONE = ZoneId.of("Europe/Rome");

  public AnalyzerConfig {
    zone = zone == null ? DEFAULT_ZONE : zone;
    businessHours = businessHours == null ? BusinessHours.DEFAULT : businessHours;
    products = products == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(products));
  }

  /**
   * Looks a product up by exact name, then case-insensitively.
   *
   * @param name product name
   * @return product configuration when present
   */
  public Optional<ProductConfig> product(String name) {
    if (name == null) {
      return Optional.empty();
    }
    ProductConfig exact = products.get(name);
    if (exact != null) {
      return Optional.of(exact);
    }
    return products.values().stream().filter(product -> product.name().equalsIgnoreCase(name)).findFirst();
  }

  /**
   * @param name product name
   * @return product configuration
   * @throws ConfigurationException when no such product is configured
   */
  public ProductConfig requireProduct(String name) {
    return product(name).orElseThrow(() -> new ConfigurationException(
        "Product '" + name + "' not found in configuration. Available: " + productNames()));
  }

  public List<String> productNames() {
    return new ArrayList<>(products.keySet());
  }
}
