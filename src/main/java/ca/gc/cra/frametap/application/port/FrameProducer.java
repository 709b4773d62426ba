package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.io.IOException;

/**
 * Supplies raw images to the publish loop.
 *
 * @since 0.1.0
 */
public interface FrameProducer extends AutoCloseable {
  /**
   * Produces the next raw uint8 image.
   *
   * @param sequence zero-based frame number
   * @return raw payload with an empty annotation
   * @throws IOException if the underlying image cannot be read
   */
  ImagePayload next(long sequence) throws IOException;

  @Override
  default void close() {}
}
