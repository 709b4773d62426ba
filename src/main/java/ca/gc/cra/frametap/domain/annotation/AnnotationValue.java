package ca.gc.cra.frametap.domain.annotation;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Closed variant describing annotation data attached to frames.
 * <p><strong>Why:</strong> Publishers attach free-form nested records; a closed variant keeps flattening and
 * JSON/CSV serialization total over every shape an annotation can take.</p>
 * <p><strong>Thread-safety:</strong> All variants are immutable.</p>
 *
 * @since 0.1.0
 */
public sealed interface AnnotationValue
    permits AnnotationValue.NullValue,
        AnnotationValue.BoolValue,
        AnnotationValue.NumberValue,
        AnnotationValue.TextValue,
        AnnotationValue.SequenceValue,
        AnnotationValue.SetValue,
        AnnotationValue.MappingValue {

  /**
   * Converts plain Java values (maps, collections, strings, numbers, booleans, {@code null}) into the variant.
   *
   * @param value value to convert; maps must use string keys
   * @return equivalent annotation value
   * @throws IllegalArgumentException if the value has an unsupported type or a non-string map key
   */
  static AnnotationValue fromJava(Object value) {
    if (value == null) {
      return NullValue.INSTANCE;
    }
    if (value instanceof AnnotationValue annotation) {
      return annotation;
    }
    if (value instanceof Boolean b) {
      return new BoolValue(b);
    }
    if (value instanceof Number n) {
      return new NumberValue(n);
    }
    if (value instanceof CharSequence text) {
      return new TextValue(text.toString());
    }
    if (value instanceof Map<?, ?> map) {
      Map<String, AnnotationValue> entries = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : map.entrySet()) {
        if (!(entry.getKey() instanceof String key)) {
          throw new IllegalArgumentException("annotation keys must be strings (was " + entry.getKey() + ")");
        }
        entries.put(key, fromJava(entry.getValue()));
      }
      return new MappingValue(entries);
    }
    if (value instanceof Set<?> set) {
      Set<AnnotationValue> elements = new LinkedHashSet<>();
      for (Object element : set) {
        elements.add(fromJava(element));
      }
      return new SetValue(elements);
    }
    if (value instanceof Collection<?> collection) {
      List<AnnotationValue> elements = new ArrayList<>(collection.size());
      for (Object element : collection) {
        elements.add(fromJava(element));
      }
      return new SequenceValue(elements);
    }
    throw new IllegalArgumentException("unsupported annotation value type " + value.getClass().getName());
  }

  /** JSON {@code null}. */
  enum NullValue implements AnnotationValue {
    INSTANCE
  }

  /**
   * Boolean scalar.
   *
   * @param value wrapped flag
   */
  record BoolValue(boolean value) implements AnnotationValue {}

  /**
   * Numeric scalar. Integral inputs are widened to {@link Long}, floating inputs to {@link Double};
   * {@link BigInteger} and {@link BigDecimal} are kept as-is.
   *
   * @param value wrapped number
   */
  record NumberValue(Number value) implements AnnotationValue {
    public NumberValue {
      Objects.requireNonNull(value, "value");
      if (value instanceof Integer || value instanceof Short || value instanceof Byte) {
        value = value.longValue();
      } else if (value instanceof Float) {
        value = value.doubleValue();
      }
    }

    /**
     * Creates a floating-point value.
     *
     * @param value number to wrap
     * @return wrapped value
     */
    public static NumberValue of(double value) {
      return new NumberValue(value);
    }
  }

  /**
   * String scalar.
   *
   * @param value wrapped text
   */
  record TextValue(String value) implements AnnotationValue {
    public TextValue {
      Objects.requireNonNull(value, "value");
    }
  }

  /**
   * Ordered sequence.
   *
   * @param elements immutable element list
   */
  record SequenceValue(List<AnnotationValue> elements) implements AnnotationValue {
    public SequenceValue {
      elements = List.copyOf(elements);
    }
  }

  /**
   * Unordered collection of distinct values. Iteration order is whatever the producer supplied and callers must
   * not depend on it.
   *
   * @param elements immutable element set
   */
  record SetValue(Set<AnnotationValue> elements) implements AnnotationValue {
    public SetValue {
      elements = Collections.unmodifiableSet(new LinkedHashSet<>(elements));
    }
  }

  /**
   * String-keyed mapping preserving insertion order.
   *
   * @param entries immutable entries
   */
  record MappingValue(Map<String, AnnotationValue> entries) implements AnnotationValue {
    /** Mapping with no entries. */
    public static final MappingValue EMPTY = new MappingValue(Map.of());

    public MappingValue {
      Map<String, AnnotationValue> copy = new LinkedHashMap<>();
      for (Map.Entry<String, AnnotationValue> entry : entries.entrySet()) {
        copy.put(
            Objects.requireNonNull(entry.getKey(), "key"),
            Objects.requireNonNull(entry.getValue(), "value"));
      }
      entries = Collections.unmodifiableMap(copy);
    }

    /**
     * Looks up a top-level entry.
     *
     * @param key entry key
     * @return value when present
     */
    public Optional<AnnotationValue> get(String key) {
      return Optional.ofNullable(entries.get(key));
    }

    /**
     * Returns a copy with {@code key} set to {@code value}, replacing any existing entry in place.
     *
     * @param key entry key
     * @param value entry value
     * @return new mapping
     */
    public MappingValue with(String key, AnnotationValue value) {
      Map<String, AnnotationValue> copy = new LinkedHashMap<>(entries);
      copy.put(key, value);
      return new MappingValue(copy);
    }

    public boolean isEmpty() {
      return entries.isEmpty();
    }

    public int size() {
      return entries.size();
    }
  }
}
