package ca.gc.cra.frametap.adapter.kafka;

import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import java.nio.BufferUnderflowException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.ArrayList;
import java.util.List;

/**
 * Length-prefixed framing that carries a {@link MultipartMessage} in a single Kafka record value.
 *
 * <p>Layout (big-endian): {@code u32 count}, then per part {@code u32 length} followed by the bytes.</p>
 *
 * @since 0.1.0
 */
public final class MultipartFraming {
  /** Upper bound on parts accepted when decoding; the protocol never uses more than six. */
  static final int MAX_PARTS = 64;

  private MultipartFraming() {}

  /**
   * Serializes a message.
   *
   * @param message message to frame
   * @return record value
   */
  public static byte[] encode(MultipartMessage message) {
    long size = 4;
    for (byte[] part : message.parts()) {
      size += 4L + part.length;
    }
    if (size > Integer.MAX_VALUE) {
      throw new IllegalArgumentException("message too large to frame: " + size + " bytes");
    }
    ByteBuffer buffer = ByteBuffer.allocate((int) size).order(ByteOrder.BIG_ENDIAN);
    buffer.putInt(message.size());
    for (byte[] part : message.parts()) {
      buffer.putInt(part.length);
      buffer.put(part);
    }
    return buffer.array();
  }

  /**
   * Parses a record value.
   *
   * @param value framed bytes
   * @return decoded message
   * @throws IllegalArgumentException if the framing is truncated, oversized, or has trailing bytes
   */
  public static MultipartMessage decode(byte[] value) {
    if (value == null) {
      throw new IllegalArgumentException("record value must not be null");
    }
    ByteBuffer buffer = ByteBuffer.wrap(value).order(ByteOrder.BIG_ENDIAN);
    try {
      long count = Integer.toUnsignedLong(buffer.getInt());
      if (count > MAX_PARTS) {
        throw new IllegalArgumentException("part count " + count + " exceeds " + MAX_PARTS);
      }
      List<byte[]> parts = new ArrayList<>((int) count);
      for (int i = 0; i < count; i++) {
        long length = Integer.toUnsignedLong(buffer.getInt());
        if (length > buffer.remaining()) {
          throw new IllegalArgumentException(
              "part " + i + " declares " + length + " bytes but only " + buffer.remaining() + " remain");
        }
        byte[] part = new byte[(int) length];
        buffer.get(part);
        parts.add(part);
      }
      if (buffer.hasRemaining()) {
        throw new IllegalArgumentException(buffer.remaining() + " trailing bytes after " + count + " parts");
      }
      return new MultipartMessage(parts);
    } catch (BufferUnderflowException ex) {
      throw new IllegalArgumentException("truncated multipart framing", ex);
    }
  }
}
