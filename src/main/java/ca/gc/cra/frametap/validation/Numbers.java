package ca.gc.cra.frametap.validation;

/**
 * <strong>What:</strong> Numeric validation helpers used by FrameTap CLI and configuration parsing.
 * <p><strong>Why:</strong> Guards poll timeouts, queue capacities, inhibition periods, and window lengths before
 * the subscriber allocates sockets or opens files.</p>
 * <p><strong>Role:</strong> Domain support utilities invoked by configuration records and loaders.</p>
 * <p><strong>Thread-safety:</strong> Immutable stateless utility.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; throws {@link IllegalArgumentException} when
 * validation fails.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Numbers {
  private Numbers() {
    // Utility
  }

  /**
   * Validates that an integral value falls within an inclusive range.
   *
   * @param name logical parameter name included in diagnostics; defaults to {@code "value"} when blank
   * @param value candidate value expressed in the caller's units (e.g., frames, ms)
   * @param min minimum inclusive value
   * @param max maximum inclusive value
   * @return the validated value for fluent call sites
   * @throws IllegalArgumentException if {@code value} lies outside {@code [min, max]}
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          label(name) + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Validates that a duration in seconds is finite and at least {@code min}.
   *
   * @param name logical parameter name included in diagnostics
   * @param seconds candidate duration in seconds
   * @param min minimum inclusive duration in seconds
   * @return the validated value
   * @throws IllegalArgumentException if the value is NaN, infinite, or below {@code min}
   */
  public static double requireSecondsAtLeast(String name, double seconds, double min) {
    if (Double.isNaN(seconds) || Double.isInfinite(seconds)) {
      throw new IllegalArgumentException(label(name) + " must be a finite number of seconds");
    }
    if (seconds < min) {
      throw new IllegalArgumentException(
          label(name) + " must be >= " + min + " seconds (was " + seconds + ")");
    }
    return seconds;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
