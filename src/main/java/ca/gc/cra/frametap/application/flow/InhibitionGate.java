package ca.gc.cra.frametap.application.flow;

/**
 * Enforces a minimum spacing between persisted frames.
 *
 * <p>A frame is eligible when {@code now >= lastPersistedAt + period}. Eligibility moves {@code lastPersistedAt}
 * forward immediately, so a write that later fails is not retried before the next eligible window. A period of
 * zero admits every frame.</p>
 *
 * @since 0.1.0
 */
public final class InhibitionGate {
  private final double periodSeconds;
  private double lastPersistedAt = Double.NEGATIVE_INFINITY;

  /**
   * Creates a gate.
   *
   * @param periodSeconds minimum spacing in seconds; must be {@code >= 0}
   * @throws IllegalArgumentException if the period is negative or not finite
   */
  public InhibitionGate(double periodSeconds) {
    if (!(periodSeconds >= 0d) || Double.isInfinite(periodSeconds)) {
      throw new IllegalArgumentException("inhibition period must be >= 0 (was " + periodSeconds + ")");
    }
    this.periodSeconds = periodSeconds;
  }

  /**
   * Checks eligibility and, when eligible, records {@code now} as the last persisted time.
   *
   * @param now current time in epoch seconds
   * @return {@code true} if the frame may be persisted
   */
  public boolean tryAcquire(double now) {
    if (now >= lastPersistedAt + periodSeconds) {
      lastPersistedAt = now;
      return true;
    }
    return false;
  }

  public double periodSeconds() {
    return periodSeconds;
  }
}
