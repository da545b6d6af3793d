package ca.gc.cra.qaops.application.extract;

import java.util.Locale;
import java.util.Objects;

/**
 * Product and environment pair used as an extractor lookup key. Products are upper-cased and environments
 * lower-cased so lookups are insensitive to configuration casing.
 *
 * @param product product name, for example {@code SEND}
 * @param environment environment name, for example {@code prod}
 * @since 0.1.0
 */
public record ProductEnvironment(String product, String environment) {
  /** Environment every product must provide an extractor for. */
  public static final String PROD = "prod";

  public ProductEnvironment {
    product = Objects.requireNonNull(product, "product").trim().toUpperCase(Locale.ROOT);
    environment = Objects.requireNonNull(environment, "environment").trim().toLowerCase(Locale.ROOT);
  }

  /**
   * @return key for the production environment of the same product
   */
  public ProductEnvironment asProd() {
    return new ProductEnvironment(product, PROD);
  }

  @Override
  public String toString() {
    return product + "-" + environment;
  }
}
