package ca.gc.cra.frametap.application.port;

/**
 * Checked exception signalling that a frame transport can no longer deliver or accept messages.
 *
 * <p>Fatal to the loop that observes it: the subscriber stops and the CLI exits with an I/O error.</p>
 *
 * @since 0.1.0
 */
public final class TransportException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param message human-readable error
   */
  public TransportException(String message) {
    super(message);
  }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param message human-readable error
   * @param cause socket or client failure
   */
  public TransportException(String message, Throwable cause) {
    super(message, cause);
  }
}
