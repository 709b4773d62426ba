package ca.gc.cra.frametap.domain.frame;

import java.util.Locale;

/**
 * File containers the image writer can produce.
 *
 * @since 0.1.0
 */
public enum ImageFormat {
  /** Lossy JPEG, quality-controlled. */
  JPEG(".jpg", "jpg"),
  /** Lossless PNG. */
  PNG(".png", "png");

  private final String extension;
  private final String imageIoName;

  ImageFormat(String extension, String imageIoName) {
    this.extension = extension;
    this.imageIoName = imageIoName;
  }

  /**
   * File extension including the leading dot.
   *
   * @return extension such as {@code .jpg}
   */
  public String extension() {
    return extension;
  }

  /**
   * Format name understood by {@code javax.imageio}.
   *
   * @return writer format name
   */
  public String imageIoName() {
    return imageIoName;
  }

  /**
   * Parses a format name.
   *
   * @param value {@code jpeg}, {@code jpg} or {@code png}, case-insensitive
   * @return parsed format
   * @throws IllegalArgumentException if the value is not recognized
   */
  public static ImageFormat fromString(String value) {
    if (value == null || value.isBlank()) {
      return JPEG;
    }
    return switch (value.trim().toLowerCase(Locale.ROOT)) {
      case "jpeg", "jpg" -> JPEG;
      case "png" -> PNG;
      default -> throw new IllegalArgumentException("imageEncoding must be JPEG or PNG (was " + value + ")");
    };
  }
}
