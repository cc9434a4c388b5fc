package ai.drivewise.risk.api;

/**
 * <strong>What:</strong> Process exit codes shared by the {@code drivewise} subcommands.
 * <p><strong>Why:</strong> Lets supervisors tell a misconfigured deployment from an upstream outage without
 * parsing logs.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** A configuration file or sink directory could not be read or written. */
  IO_ERROR(3),
  /** Adapters could not be wired from an otherwise valid configuration. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value reported to the operating system.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
