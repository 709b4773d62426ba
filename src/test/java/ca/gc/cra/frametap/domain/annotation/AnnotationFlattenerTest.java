package ca.gc.cra.frametap.domain.annotation;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.SequenceValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class AnnotationFlattenerTest {

  @Test
  void nestedMappingsBecomeDottedKeys() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("a", 1);
    nested.put("c", Map.of("x", 2));
    MappingValue source = (MappingValue) AnnotationValue.fromJava(nested);

    MappingValue flat = AnnotationFlattener.flatten(source);

    assertEquals(List.of("a", "c.x"), List.copyOf(flat.entries().keySet()));
    assertEquals(new NumberValue(1L), flat.entries().get("a"));
    assertEquals(new NumberValue(2L), flat.entries().get("c.x"));
  }

  @Test
  void flatMappingIsUnchanged() {
    Map<String, Object> plain = new LinkedHashMap<>();
    plain.put("gain", 1.5);
    plain.put("label", "door");
    MappingValue source = (MappingValue) AnnotationValue.fromJava(plain);

    assertEquals(source, AnnotationFlattener.flatten(source));
  }

  @Test
  void sequencesAreIndexed() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("roi", List.of(10, Map.of("w", 4)));
    MappingValue flat = AnnotationFlattener.flatten((MappingValue) AnnotationValue.fromJava(nested));

    assertEquals(new NumberValue(10L), flat.entries().get("roi.0"));
    assertEquals(new NumberValue(4L), flat.entries().get("roi.1.w"));
    assertEquals(2, flat.size());
  }

  @Test
  void setsAreIndexedInIterationOrder() {
    LinkedHashSet<String> tags = new LinkedHashSet<>(List.of("night", "ir"));
    MappingValue flat = AnnotationFlattener.flatten(
        (MappingValue) AnnotationValue.fromJava(Map.of("tags", tags)));

    assertEquals(new TextValue("night"), flat.entries().get("tags.0"));
    assertEquals(new TextValue("ir"), flat.entries().get("tags.1"));
  }

  @Test
  void emptyContainersAreKeptAsLeaves() {
    Map<String, Object> nested = new LinkedHashMap<>();
    nested.put("meta", Map.of());
    nested.put("points", List.of());
    MappingValue flat = AnnotationFlattener.flatten((MappingValue) AnnotationValue.fromJava(nested));

    assertEquals(MappingValue.EMPTY, flat.entries().get("meta"));
    assertEquals(new SequenceValue(List.of()), flat.entries().get("points"));
  }
}
