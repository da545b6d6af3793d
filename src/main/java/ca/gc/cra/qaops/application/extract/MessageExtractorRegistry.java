package ca.gc.cra.qaops.application.extract;

import ca.gc.cra.qaops.config.ConfigurationException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lookup table from {@link ProductEnvironment} to {@link MessageExtractor}.
 * <p><strong>Semantics:</strong> An exact match wins; otherwise the product's {@code prod} extractor is used;
 * a product with no extractor at all is a configuration error.</p>
 * <p><strong>Thread-safety:</strong> Immutable after construction.</p>
 *
 * @since 0.1.0
 */
public final class MessageExtractorRegistry {
  private static final Logger log = LoggerFactory.getLogger(MessageExtractorRegistry.class);

  private final Map<ProductEnvironment, MessageExtractor> extractors;

  /**
   * @param extractors extractors keyed by their own {@link MessageExtractor#productEnvironment()}
   */
  public MessageExtractorRegistry(List<MessageExtractor> extractors) {
    Map<ProductEnvironment, MessageExtractor> table = new LinkedHashMap<>();
    for (MessageExtractor extractor : Objects.requireNonNull(extractors, "extractors")) {
      MessageExtractor previous = table.put(extractor.productEnvironment(), extractor);
      if (previous != null) {
        throw new IllegalArgumentException("Duplicate extractor for " + extractor.productEnvironment());
      }
    }
    this.extractors = Collections.unmodifiableMap(table);
  }

  /**
   * Registry with the built-in variants: SEND prod/uat read attachment titles, INTEROP prod/test read
   * forwarded files.
   *
   * @return standard registry
   */
  public static MessageExtractorRegistry standard() {
    return new MessageExtractorRegistry(List.of(
        new TitleAlarmExtractor(new ProductEnvironment("SEND", "prod")),
        new TitleAlarmExtractor(new ProductEnvironment("SEND", "uat")),
        new FileAttachmentExtractor(new ProductEnvironment("INTEROP", "prod")),
        new FileAttachmentExtractor(new ProductEnvironment("INTEROP", "test"))));
  }

  /**
   * Resolves the extractor for a product and environment.
   *
   * @param product product name, any case
   * @param environment environment name, any case
   * @return matching extractor, or the product's production extractor
   * @throws ConfigurationException when the product has no extractor
   */
  public MessageExtractor resolve(String product, String environment) {
    ProductEnvironment key = new ProductEnvironment(product, environment);
    MessageExtractor exact = extractors.get(key);
    if (exact != null) {
      return exact;
    }
    MessageExtractor prod = extractors.get(key.asProd());
    if (prod != null) {
      log.debug("No extractor for {}; falling back to {}", key, prod);
      return prod;
    }
    throw new ConfigurationException("No message extractor available for product " + key.product()
        + " (environment " + key.environment() + "). Supported: " + supported());
  }

  /**
   * @return registered keys in registration order
   */
  public List<ProductEnvironment> supported() {
    return new ArrayList<>(extractors.keySet());
  }
}
