package ca.gc.cra.frametap.domain.frame;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import java.util.Objects;

/**
 * Payload of a {@code LogFrame}.
 *
 * @param annotation structured record published by the source
 * @since 0.1.0
 */
public record LogPayload(MappingValue annotation) implements Payload {
  public LogPayload {
    Objects.requireNonNull(annotation, "annotation");
  }
}
