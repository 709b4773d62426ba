package ca.gc.cra.frametap.config;

import java.util.Locale;

/**
 * <strong>What:</strong> Transport used to receive (or, for {@code publish}, send) frames.
 * <p><strong>Why:</strong> Selects between the native ZeroMQ socket and the Kafka bridge.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 0.1.0
 */
public enum IngressMode {
  /** ZeroMQ PUB/SUB sockets. */
  ZMQ,
  /** Apache Kafka topic carrying length-prefixed multipart records. */
  KAFKA;

  /**
   * Parses a mode name, defaulting to {@link #ZMQ} when blank.
   *
   * @param value textual representation such as {@code "zmq"} or {@code "kafka"}
   * @return parsed mode
   * @throws IllegalArgumentException if the string does not match a known mode
   */
  public static IngressMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return ZMQ;
    }
    try {
      return IngressMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown transport mode: " + value, ex);
    }
  }
}
