package ca.gc.cra.lattice.api;

/**
 * <strong>What:</strong> Process exit codes returned by {@code latticectl} commands.
 * <p><strong>Why:</strong> Scripts distinguish bad arguments, bad configuration and an unreachable lattice.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Command completed; an empty listing is still a success. */
  SUCCESS(0),
  /** Unexpected failure. */
  RUNTIME_FAILURE(1),
  /** Command-line arguments were invalid. */
  INVALID_ARGS(2),
  /** Configuration was missing or malformed. */
  CONFIG_ERROR(3),
  /** The bus could not be reached or rejected a publish or subscribe. */
  TRANSPORT_ERROR(4),
  /** Interrupted (e.g., SIGINT) before completing. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  public int code() {
    return code;
  }
}
