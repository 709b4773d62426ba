package ca.gc.cra.frametap.application.port;

/**
 * <strong>What:</strong> Domain port abstracting FrameTap metrics emission.
 * <p><strong>Why:</strong> Lets the subscriber and publisher loops count drops, writes, and queue overflows
 * without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates from the network and
 * render threads.</p>
 * <p><strong>Performance:</strong> Calls sit on the per-frame path and must be non-blocking.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code subscriber.dropped}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code subscriber.decode.shortMessage}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value; units are encoded in the key (e.g., {@code delayMillis})
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
