package ca.gc.cra.frametap.domain.frame;

import java.util.Locale;

/**
 * Element types accepted in frame metadata, named the way array libraries name them.
 *
 * @since 0.1.0
 */
public enum PixelType {
  UINT8("uint8", 1),
  INT8("int8", 1),
  UINT16("uint16", 2),
  INT16("int16", 2),
  INT32("int32", 4),
  FLOAT32("float32", 4),
  FLOAT64("float64", 8);

  private final String label;
  private final int bytesPerElement;

  PixelType(String label, int bytesPerElement) {
    this.label = label;
    this.bytesPerElement = bytesPerElement;
  }

  public String label() {
    return label;
  }

  public int bytesPerElement() {
    return bytesPerElement;
  }

  /**
   * Parses a dtype label such as {@code uint8}.
   *
   * @param label dtype label; case-insensitive
   * @return matching type
   * @throws IllegalArgumentException if the label is unknown
   */
  public static PixelType fromLabel(String label) {
    if (label != null) {
      String normalized = label.trim().toLowerCase(Locale.ROOT);
      for (PixelType type : values()) {
        if (type.label.equals(normalized)) {
          return type;
        }
      }
    }
    throw new IllegalArgumentException("unsupported dtype: " + label);
  }
}
