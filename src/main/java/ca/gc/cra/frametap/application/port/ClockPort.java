package ca.gc.cra.frametap.application.port;

/**
 * <strong>What:</strong> Domain port supplying wall-clock time to the subscriber loop.
 * <p><strong>Why:</strong> Inhibition, window rotation, and stats reporting are all time-driven; tests inject a
 * manual clock to step through them deterministically.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be thread-safe.</p>
 *
 * @implNote Default implementation delegates to {@link System#currentTimeMillis()}.
 * @since 0.1.0
 * @see ca.gc.cra.frametap.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z; subject to system clock adjustments
   */
  long nowMillis();

  /**
   * Returns the current epoch time in fractional seconds, the unit frame timestamps use.
   *
   * @return seconds since 1970-01-01T00:00:00Z
   */
  default double nowSeconds() {
    return nowMillis() / 1_000d;
  }

  /**
   * Default {@link ClockPort} using {@link System#currentTimeMillis()}.
   */
  ClockPort SYSTEM = System::currentTimeMillis;
}
