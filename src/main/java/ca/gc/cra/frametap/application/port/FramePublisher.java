package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.MultipartMessage;

/**
 * Egress port used by the publish loop to send encoded frames.
 *
 * <p>Publishing is fire-and-forget; no acknowledgement flows back from subscribers.</p>
 *
 * @since 0.1.0
 */
public interface FramePublisher extends AutoCloseable {
  /**
   * Opens the underlying socket or client.
   *
   * @throws TransportException if the transport cannot be opened
   */
  void start() throws TransportException;

  /**
   * Sends one multipart message.
   *
   * @param message encoded frame
   * @param key routing key (the source id); transports without keys ignore it
   * @throws TransportException if the message could not be handed to the transport
   */
  void publish(MultipartMessage message, String key) throws TransportException;

  @Override
  void close();
}
