package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;

/**
 * <strong>What:</strong> Appends annotation records to time-windowed log files.
 * <p><strong>Role:</strong> Persistence port owned by the network thread; implemented by
 * {@code RotatingAnnotationWriter}.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe.</p>
 *
 * @since 0.1.0
 */
public interface AnnotationSinkPort extends AutoCloseable {
  /**
   * Appends a record, opening a new window stamped with {@code frameTime} when none is open.
   *
   * @param frameTime frame timestamp in epoch seconds
   * @param record annotation with reserved keys already merged
   * @throws PersistenceException if the window file cannot be opened or written
   */
  void append(double frameTime, MappingValue record) throws PersistenceException;

  /**
   * Publishes the open window when {@code now} is past its end. Called once per poll cycle.
   *
   * @param now current time in epoch seconds
   */
  void rotateIfExpired(double now);

  /**
   * Publishes any open window regardless of age.
   */
  @Override
  void close();
}
