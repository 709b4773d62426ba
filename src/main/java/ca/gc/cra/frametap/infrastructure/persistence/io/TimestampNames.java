package ca.gc.cra.frametap.infrastructure.persistence.io;

import ca.gc.cra.frametap.domain.frame.ImageFormat;
import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Objects;

/**
 * Deterministic file names derived from frame timestamps.
 *
 * <p>Names follow {@code yyyy-MM-dd_HH:mm:ss.SSSZ} in the configured zone, so the same instant and id
 * always produce the same name.</p>
 *
 * @since 0.1.0
 */
public final class TimestampNames {
  /** Prefix for staging files that are still being written. */
  public static final String TEMP_PREFIX = "transferring.";
  /** Pattern shared by image and log file names. */
  public static final String PATTERN = "uuuu-MM-dd_HH:mm:ss.SSSZ";

  private final DateTimeFormatter formatter;

  /**
   * Creates a name generator for the given zone.
   *
   * @param zone zone used to render timestamps
   */
  public TimestampNames(ZoneId zone) {
    this.formatter = DateTimeFormatter.ofPattern(PATTERN).withZone(Objects.requireNonNull(zone, "zone"));
  }

  /**
   * Formats epoch seconds with millisecond precision.
   *
   * @param epochSeconds seconds since the epoch
   * @return formatted timestamp
   */
  public String format(double epochSeconds) {
    long millis = (long) Math.floor(epochSeconds * 1_000d);
    return formatter.format(Instant.ofEpochMilli(millis));
  }

  /**
   * Builds the final image file name.
   *
   * @param frameTime frame timestamp in epoch seconds
   * @param fileId sanitized file id
   * @param format output format supplying the extension
   * @return file name without directory
   */
  public String imageName(double frameTime, String fileId, ImageFormat format) {
    return format(frameTime) + '_' + fileId + format.extension();
  }

  /**
   * Strips whitespace, control characters and path separators from an id.
   *
   * @param id raw id; {@code null} yields an empty string
   * @return sanitized id, possibly empty
   */
  public static String sanitize(String id) {
    if (id == null) {
      return "";
    }
    StringBuilder sb = new StringBuilder(id.length());
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      if (!Character.isWhitespace(c) && !Character.isISOControl(c) && c != '/' && c != '\\') {
        sb.append(c);
      }
    }
    return sb.toString();
  }
}
