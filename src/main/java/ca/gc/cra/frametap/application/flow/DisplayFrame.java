package ca.gc.cra.frametap.application.flow;

import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.util.Objects;

/**
 * Item moved through the handoff queue from the network thread to the render thread.
 *
 * @param sourceId publisher identifier
 * @param image raw image
 * @since 0.1.0
 */
public record DisplayFrame(String sourceId, ImagePayload image) {
  public DisplayFrame {
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(image, "image");
  }
}
