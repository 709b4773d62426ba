package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.ImagePayload;

/**
 * Render target driven by the display loop. Only ever called from the render thread.
 *
 * @since 0.1.0
 */
public interface DisplayPort extends AutoCloseable {
  /**
   * Presents the latest image for a source.
   *
   * @param sourceId publisher identifier
   * @param image raw image
   */
  void show(String sourceId, ImagePayload image);

  /**
   * Called once per render tick after all {@link #show} calls of that tick.
   */
  default void refresh() {}

  @Override
  default void close() {}
}
