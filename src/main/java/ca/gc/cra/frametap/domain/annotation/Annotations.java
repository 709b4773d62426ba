package ca.gc.cra.frametap.domain.annotation;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Helpers applied to every annotation before it is written or echoed.
 *
 * @since 0.1.0
 */
public final class Annotations {
  /** Reserved key carrying the publisher identifier. */
  public static final String SOURCE_ID_KEY = "source_id";
  /** Reserved key carrying the frame timestamp in epoch seconds. */
  public static final String FRAME_TIME_KEY = "frame_time";

  private Annotations() {}

  /**
   * Merges the reserved keys into an annotation. Existing {@code source_id} and {@code frame_time} entries are
   * overwritten; the reserved keys lead the resulting mapping.
   *
   * @param annotation publisher annotation
   * @param sourceId publisher identifier
   * @param frameTime frame timestamp in epoch seconds
   * @return annotation carrying the reserved keys
   */
  public static MappingValue withReservedKeys(MappingValue annotation, String sourceId, double frameTime) {
    Objects.requireNonNull(annotation, "annotation");
    Objects.requireNonNull(sourceId, "sourceId");
    Map<String, AnnotationValue> merged = new LinkedHashMap<>();
    merged.put(SOURCE_ID_KEY, new TextValue(sourceId));
    merged.put(FRAME_TIME_KEY, NumberValue.of(frameTime));
    for (Map.Entry<String, AnnotationValue> entry : annotation.entries().entrySet()) {
      if (!entry.getKey().equals(SOURCE_ID_KEY) && !entry.getKey().equals(FRAME_TIME_KEY)) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
    return new MappingValue(merged);
  }

  /**
   * Walks a dot-separated key path through nested mappings and returns the string found there.
   *
   * @param annotation root mapping
   * @param keyPath dot-separated path such as {@code camera.name}
   * @return the string at the path; empty when a segment is missing or the value is not a string
   */
  public static Optional<String> resolveText(MappingValue annotation, String keyPath) {
    if (annotation == null || keyPath == null || keyPath.isEmpty()) {
      return Optional.empty();
    }
    AnnotationValue current = annotation;
    for (String segment : keyPath.split("\\.", -1)) {
      if (!(current instanceof MappingValue mapping)) {
        return Optional.empty();
      }
      Optional<AnnotationValue> next = mapping.get(segment);
      if (next.isEmpty()) {
        return Optional.empty();
      }
      current = next.get();
    }
    if (current instanceof TextValue text) {
      return Optional.of(text.value());
    }
    return Optional.empty();
  }
}
