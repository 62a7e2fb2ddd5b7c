package ca.gc.cra.rulesync.api;

/**
 * <strong>What:</strong> Process exit codes returned by the RULESYNC commands.
 * <p><strong>Why:</strong> Schedulers and CI jobs branch on the status, so each failure class keeps a stable
 * number.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Run completed; for {@code sync}, at least one ruleset produced an artifact. */
  SUCCESS(0),
  /** Command-line arguments or the configuration file were invalid. */
  INVALID_ARGS(2),
  /** Local I/O failed (configuration file, cache or output directory). */
  IO_ERROR(3),
  /** Configuration values were rejected while wiring the pipeline. */
  CONFIG_ERROR(4),
  /** No ruleset succeeded, or an unexpected failure occurred. */
  RUNTIME_FAILURE(5),
  /** Process was interrupted (e.g., SIGINT). */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric status passed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
