package ca.gc.cra.frametap.infrastructure.codec;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.BoolValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NullValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.SequenceValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.SetValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Jackson bridge between JSON text and {@link AnnotationValue} trees.
 *
 * <p>Integral numbers decode as {@link Long} (or {@link BigInteger} when they overflow), other numbers as
 * {@link Double}. Sets serialize as JSON arrays.</p>
 *
 * @since 0.1.0
 */
public final class AnnotationJson {
  private static final ObjectMapper MAPPER = new ObjectMapper();
  private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

  private AnnotationJson() {}

  /**
   * Shared mapper configured for annotation and metadata parsing.
   *
   * @return thread-safe mapper
   */
  static ObjectMapper mapper() {
    return MAPPER;
  }

  /**
   * Parses a JSON object into a mapping. An empty buffer or JSON {@code null} yields an empty mapping.
   *
   * @param json UTF-8 JSON bytes
   * @return parsed mapping
   * @throws IOException if the bytes are not JSON or not an object
   */
  public static MappingValue readMapping(byte[] json) throws IOException {
    if (json == null || json.length == 0) {
      return MappingValue.EMPTY;
    }
    JsonNode node = MAPPER.readTree(json);
    if (node == null || node.isNull() || node.isMissingNode()) {
      return MappingValue.EMPTY;
    }
    if (!node.isObject()) {
      throw new IOException("annotation must be a JSON object (was " + node.getNodeType() + ")");
    }
    return (MappingValue) fromNode(node);
  }

  /**
   * Converts a Jackson tree into an annotation value.
   *
   * @param node JSON node
   * @return equivalent annotation value
   */
  public static AnnotationValue fromNode(JsonNode node) {
    if (node == null || node.isNull() || node.isMissingNode()) {
      return NullValue.INSTANCE;
    }
    if (node.isObject()) {
      Map<String, AnnotationValue> entries = new LinkedHashMap<>();
      Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> field = fields.next();
        entries.put(field.getKey(), fromNode(field.getValue()));
      }
      return new MappingValue(entries);
    }
    if (node.isArray()) {
      List<AnnotationValue> elements = new ArrayList<>(node.size());
      for (JsonNode element : node) {
        elements.add(fromNode(element));
      }
      return new SequenceValue(elements);
    }
    if (node.isBoolean()) {
      return new BoolValue(node.booleanValue());
    }
    if (node.isIntegralNumber()) {
      return node.canConvertToLong()
          ? new NumberValue(node.longValue())
          : new NumberValue(node.bigIntegerValue());
    }
    if (node.isNumber()) {
      return new NumberValue(node.doubleValue());
    }
    return new TextValue(node.asText());
  }

  /**
   * Converts an annotation value into a Jackson tree.
   *
   * @param value annotation value
   * @return JSON node
   */
  public static JsonNode toNode(AnnotationValue value) {
    if (value instanceof NullValue) {
      return NODES.nullNode();
    }
    if (value instanceof BoolValue b) {
      return NODES.booleanNode(b.value());
    }
    if (value instanceof NumberValue n) {
      return numberNode(n.value());
    }
    if (value instanceof TextValue t) {
      return NODES.textNode(t.value());
    }
    if (value instanceof SequenceValue sequence) {
      ArrayNode array = NODES.arrayNode(sequence.elements().size());
      sequence.elements().forEach(element -> array.add(toNode(element)));
      return array;
    }
    if (value instanceof SetValue set) {
      ArrayNode array = NODES.arrayNode(set.elements().size());
      set.elements().forEach(element -> array.add(toNode(element)));
      return array;
    }
    MappingValue mapping = (MappingValue) value;
    ObjectNode object = NODES.objectNode();
    mapping.entries().forEach((key, entry) -> object.set(key, toNode(entry)));
    return object;
  }

  /**
   * Serializes an annotation value as compact JSON text.
   *
   * @param value annotation value
   * @return JSON text on a single line
   */
  public static String writeString(AnnotationValue value) {
    try {
      return MAPPER.writeValueAsString(toNode(value));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("annotation tree could not be serialized", ex);
    }
  }

  /**
   * Serializes an annotation value as UTF-8 JSON bytes.
   *
   * @param value annotation value
   * @return JSON bytes
   */
  public static byte[] writeBytes(AnnotationValue value) {
    try {
      return MAPPER.writeValueAsBytes(toNode(value));
    } catch (JsonProcessingException ex) {
      throw new IllegalStateException("annotation tree could not be serialized", ex);
    }
  }

  private static JsonNode numberNode(Number number) {
    if (number instanceof Long l) {
      return NODES.numberNode(l);
    }
    if (number instanceof BigInteger big) {
      return NODES.numberNode(big);
    }
    if (number instanceof BigDecimal decimal) {
      return NODES.numberNode(decimal);
    }
    return NODES.numberNode(number.doubleValue());
  }
}
