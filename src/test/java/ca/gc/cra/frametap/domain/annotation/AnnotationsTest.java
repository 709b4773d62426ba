package ca.gc.cra.frametap.domain.annotation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class AnnotationsTest {

  @Test
  void reservedKeysComeFirstAndReplaceAnnotationCopies() {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("exposure", 12);
    raw.put("source_id", "spoofed");
    raw.put("frame_time", 1.0);
    MappingValue annotation = (MappingValue) AnnotationValue.fromJava(raw);

    MappingValue record = Annotations.withReservedKeys(annotation, "cam-1", 42.5);

    assertEquals(List.of("source_id", "frame_time", "exposure"), List.copyOf(record.entries().keySet()));
    assertEquals(new TextValue("cam-1"), record.entries().get("source_id"));
    assertEquals(NumberValue.of(42.5), record.entries().get("frame_time"));
  }

  @Test
  void resolveTextFollowsDottedPath() {
    MappingValue annotation = (MappingValue) AnnotationValue.fromJava(
        Map.of("camera", Map.of("serial", "SN-42"), "count", 3));

    assertEquals(Optional.of("SN-42"), Annotations.resolveText(annotation, "camera.serial"));
    assertTrue(Annotations.resolveText(annotation, "camera.model").isEmpty());
    assertTrue(Annotations.resolveText(annotation, "count").isEmpty());
    assertTrue(Annotations.resolveText(annotation, "count.inner").isEmpty());
    assertTrue(Annotations.resolveText(annotation, "").isEmpty());
  }

  @Test
  void fromJavaWidensIntegralNumbers() {
    assertEquals(new NumberValue(7L), AnnotationValue.fromJava(7));
    assertEquals(new NumberValue(1.5d), AnnotationValue.fromJava(1.5f));
    assertEquals(AnnotationValue.NullValue.INSTANCE, AnnotationValue.fromJava(null));
  }

  @Test
  void fromJavaRejectsNonStringKeys() {
    assertThrows(IllegalArgumentException.class, () -> AnnotationValue.fromJava(Map.of(1, "x")));
    assertThrows(IllegalArgumentException.class, () -> AnnotationValue.fromJava(new Object()));
  }
}
