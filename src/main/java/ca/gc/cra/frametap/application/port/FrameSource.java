package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.util.Optional;

/**
 * <strong>What:</strong> Domain port supplying multipart wire messages to the subscriber loop.
 * <p><strong>Why:</strong> Decouples the loop from ZeroMQ sockets and Kafka consumers.</p>
 * <p><strong>Role:</strong> Ingress port; implemented by {@code ZmqFrameSource} and {@code KafkaFrameSource}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the network thread.</p>
 * <p><strong>Performance:</strong> {@link #poll()} waits at most the adapter's configured timeout so the caller
 * stays responsive to cancellation.</p>
 *
 * @since 0.1.0
 */
public interface FrameSource extends AutoCloseable {
  /**
   * Opens connections and applies subscriptions.
   *
   * @throws TransportException if the transport cannot be opened
   */
  void start() throws TransportException;

  /**
   * Waits up to the configured timeout for the next complete message.
   *
   * @return the next message, or empty on timeout
   * @throws TransportException if the transport failed and no further messages can be received
   */
  Optional<MultipartMessage> poll() throws TransportException;

  /**
   * Releases sockets and client resources. Safe to call more than once.
   */
  @Override
  void close();
}
