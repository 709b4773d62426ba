package ca.gc.cra.frametap.domain.annotation;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.SequenceValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.SetValue;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Collapses nested annotations into single-level records keyed by dotted paths.
 *
 * <p>Mapping entries contribute their key, sequence and set elements contribute their zero-based position. Set
 * positions follow the set's iteration order, which is not stable across producers. An empty nested container is
 * kept as-is under its own key so the key is not lost. Scalars at the top level pass through unchanged, so a
 * flat mapping flattens to itself.</p>
 *
 * @since 0.1.0
 */
public final class AnnotationFlattener {
  private static final String SEPARATOR = ".";

  private AnnotationFlattener() {}

  /**
   * Flattens an annotation depth-first.
   *
   * @param annotation mapping to flatten
   * @return single-level mapping
   */
  public static MappingValue flatten(MappingValue annotation) {
    Objects.requireNonNull(annotation, "annotation");
    Map<String, AnnotationValue> out = new LinkedHashMap<>();
    for (Map.Entry<String, AnnotationValue> entry : annotation.entries().entrySet()) {
      walk(entry.getKey(), entry.getValue(), out);
    }
    return new MappingValue(out);
  }

  private static void walk(String path, AnnotationValue value, Map<String, AnnotationValue> out) {
    if (value instanceof MappingValue mapping && !mapping.isEmpty()) {
      for (Map.Entry<String, AnnotationValue> entry : mapping.entries().entrySet()) {
        walk(path + SEPARATOR + entry.getKey(), entry.getValue(), out);
      }
    } else if (value instanceof SequenceValue sequence && !sequence.elements().isEmpty()) {
      int index = 0;
      for (AnnotationValue element : sequence.elements()) {
        walk(path + SEPARATOR + index++, element, out);
      }
    } else if (value instanceof SetValue set && !set.elements().isEmpty()) {
      Iterator<AnnotationValue> it = set.elements().iterator();
      for (int index = 0; it.hasNext(); index++) {
        walk(path + SEPARATOR + index, it.next(), out);
      }
    } else {
      out.put(path, value);
    }
  }
}
