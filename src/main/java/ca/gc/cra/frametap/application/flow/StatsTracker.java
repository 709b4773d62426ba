package ca.gc.cra.frametap.application.flow;

import java.util.Optional;

/**
 * <strong>What:</strong> Rolling received/dropped/delay counters reported on a fixed interval.
 * <p><strong>Role:</strong> Owned by the network thread and updated between poll cycles; never performs I/O.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class StatsTracker {
  private final double intervalSeconds;
  private long received;
  private long dropped;
  private double delaySeconds;
  private double windowStart;

  /**
   * Creates a tracker.
   *
   * @param intervalSeconds reporting interval; {@code 0} disables reporting
   * @param startSeconds start of the first interval in epoch seconds
   * @throws IllegalArgumentException if the interval is negative or not finite
   */
  public StatsTracker(double intervalSeconds, double startSeconds) {
    if (!(intervalSeconds >= 0d) || Double.isInfinite(intervalSeconds)) {
      throw new IllegalArgumentException("intervalSeconds must be >= 0 (was " + intervalSeconds + ")");
    }
    this.intervalSeconds = intervalSeconds;
    this.windowStart = startSeconds;
  }

  /** Counts a message taken off the transport. */
  public void onReceived() {
    received++;
  }

  /** Counts a message that was discarded. */
  public void onDropped() {
    dropped++;
  }

  /**
   * Adds the transit delay of a delivered message.
   *
   * @param now current time in epoch seconds
   * @param frameTime publisher timestamp in epoch seconds
   */
  public void addDelay(double now, double frameTime) {
    delaySeconds += now - frameTime;
  }

  /**
   * Emits a snapshot and resets all counters once the interval has elapsed.
   *
   * @param now current time in epoch seconds
   * @return snapshot when due, otherwise empty (always empty when reporting is disabled)
   */
  public Optional<StatsSnapshot> maybeReport(double now) {
    if (intervalSeconds <= 0d) {
      return Optional.empty();
    }
    double elapsed = now - windowStart;
    if (elapsed < intervalSeconds) {
      return Optional.empty();
    }
    double fps = elapsed > 0d ? (received - dropped) / elapsed : 0d;
    double averageDelay = received > 0 ? delaySeconds / received : 0d;
    StatsSnapshot snapshot = new StatsSnapshot(received, dropped, elapsed, fps, averageDelay);
    received = 0;
    dropped = 0;
    delaySeconds = 0d;
    windowStart = now;
    return Optional.of(snapshot);
  }

  public long received() {
    return received;
  }

  public long dropped() {
    return dropped;
  }
}
