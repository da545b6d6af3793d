package ca.gc.cra.qaops.config;

/**
 * Raised when configuration is unusable: malformed YAML, invalid rule definitions or unsupported products.
 * Fatal; never retried.
 *
 * @since 0.1.0
 */
public class ConfigurationException extends IllegalArgumentException {
  private static final long serialVersionUID = 1L;

  public ConfigurationException(String message) {
    super(message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(message, cause);
  }
}
