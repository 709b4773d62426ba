package ca.gc.cra.frametap.domain.frame;

import java.util.List;
import java.util.Objects;

/**
 * Ordered message parts as moved by every transport. Part arrays are shared, not copied.
 *
 * @param parts message frames in wire order
 * @since 0.1.0
 */
public record MultipartMessage(List<byte[]> parts) {
  public MultipartMessage {
    Objects.requireNonNull(parts, "parts");
    for (byte[] part : parts) {
      Objects.requireNonNull(part, "part");
    }
    parts = List.copyOf(parts);
  }

  /**
   * Creates a message from individual parts.
   *
   * @param parts frames in wire order
   * @return message
   */
  public static MultipartMessage of(byte[]... parts) {
    return new MultipartMessage(List.of(parts));
  }

  public int size() {
    return parts.size();
  }

  public byte[] part(int index) {
    return parts.get(index);
  }
}
