package ca.gc.cra.qaops.api;

/**
 * Process exit codes returned by the CLI commands.
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed. */
  SUCCESS(0),
  /** Arguments were missing or malformed. */
  INVALID_ARGS(2),
  /** A configuration or event file could not be read. */
  IO_ERROR(3),
  /** The configuration is unusable. */
  CONFIG_ERROR(4),
  /** Unexpected failure during analysis. */
  RUNTIME_FAILURE(5);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
