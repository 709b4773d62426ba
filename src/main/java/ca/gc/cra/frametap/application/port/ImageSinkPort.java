package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.Envelope;

/**
 * Persists image frames as individual files.
 *
 * @since 0.1.0
 */
public interface ImageSinkPort {
  /**
   * Writes the envelope's image. Failures are cleaned up and reported through the return value; nothing is
   * thrown for I/O problems.
   *
   * @param envelope envelope carrying a raw image payload
   * @return {@code true} when the file was published under its final name
   */
  boolean write(Envelope envelope);
}
