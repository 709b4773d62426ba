package ca.gc.cra.frametap.api;

/**
 * <strong>What:</strong> Process exit codes shared by the FrameTap commands.
 * <p><strong>Why:</strong> Lets supervisors and scripts tell bad arguments apart from broken
 * transports or unreadable configuration.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum ExitCode {
  /** Successful execution. */
  SUCCESS(0),
  /** Command-line arguments or configuration values were invalid. */
  INVALID_ARGS(2),
  /** A transport or file-system failure stopped the command. */
  IO_ERROR(3),
  /** The configuration file could not be parsed. */
  CONFIG_ERROR(4),
  /** Unexpected runtime failure. */
  RUNTIME_FAILURE(5),
  /** The command thread was interrupted. */
  INTERRUPTED(130);

  private final int code;

  ExitCode(int code) {
    this.code = code;
  }

  /**
   * Returns the numeric value handed to {@link System#exit(int)}.
   *
   * @return numeric exit code
   */
  public int code() {
    return code;
  }
}
