package ca.gc.cra.frametap.domain.frame;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import java.util.Objects;

/**
 * One decoded wire message.
 *
 * @param topic logical topic with any source suffix removed
 * @param sourceId publisher identifier (UTF-8 decoded)
 * @param frameTime publisher timestamp in epoch seconds; may repeat or go backwards
 * @param payload image or log body
 * @since 0.1.0
 */
public record Envelope(FrameTopic topic, String sourceId, double frameTime, Payload payload) {
  public Envelope {
    Objects.requireNonNull(topic, "topic");
    Objects.requireNonNull(sourceId, "sourceId");
    Objects.requireNonNull(payload, "payload");
  }

  public MappingValue annotation() {
    return payload.annotation();
  }

  /**
   * Returns a copy carrying a different payload, used when a JPEG body is decoded to raw pixels.
   *
   * @param replacement new payload
   * @return envelope with the same topic, source and time
   */
  public Envelope withPayload(Payload replacement) {
    return new Envelope(topic, sourceId, frameTime, replacement);
  }
}
