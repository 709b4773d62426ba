package ca.gc.cra.frametap.domain.frame;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import java.util.Arrays;
import java.util.Objects;

/**
 * Payload of a {@code VideoFrame} or {@code JpegFrame}.
 *
 * <p>For {@link PixelEncoding#RAW} the buffer holds {@code product(shape) * dtype.bytesPerElement()} bytes in
 * row-major order; three-channel images use BGR channel order. Arrays are not copied; callers hand over
 * ownership.</p>
 *
 * @param encoding buffer layout
 * @param dtype element type
 * @param shape dimensions, {@code [height, width]} or {@code [height, width, channels]}
 * @param data pixel or JPEG bytes
 * @param annotation publisher annotation
 * @since 0.1.0
 */
public record ImagePayload(
    PixelEncoding encoding, PixelType dtype, int[] shape, byte[] data, MappingValue annotation)
    implements Payload {

  public ImagePayload {
    Objects.requireNonNull(encoding, "encoding");
    Objects.requireNonNull(dtype, "dtype");
    Objects.requireNonNull(shape, "shape");
    Objects.requireNonNull(data, "data");
    Objects.requireNonNull(annotation, "annotation");
    if (shape.length < 2 || shape.length > 3) {
      throw new IllegalArgumentException("shape must have 2 or 3 dimensions (was " + shape.length + ")");
    }
    for (int dim : shape) {
      if (dim <= 0) {
        throw new IllegalArgumentException("shape dimensions must be positive: " + Arrays.toString(shape));
      }
    }
  }

  public int height() {
    return shape[0];
  }

  public int width() {
    return shape[1];
  }

  public int channels() {
    return shape.length == 3 ? shape[2] : 1;
  }

  /**
   * Number of bytes a raw buffer of this dtype and shape occupies.
   *
   * @return expected raw byte length
   */
  public long expectedRawLength() {
    long elements = 1;
    for (int dim : shape) {
      elements *= dim;
    }
    return elements * dtype.bytesPerElement();
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof ImagePayload that)) {
      return false;
    }
    return encoding == that.encoding
        && dtype == that.dtype
        && Arrays.equals(shape, that.shape)
        && Arrays.equals(data, that.data)
        && annotation.equals(that.annotation);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(encoding, dtype, annotation);
    result = 31 * result + Arrays.hashCode(shape);
    return 31 * result + Arrays.hashCode(data);
  }

  @Override
  public String toString() {
    return "ImagePayload[encoding=" + encoding
        + ", dtype=" + dtype.label()
        + ", shape=" + Arrays.toString(shape)
        + ", bytes=" + data.length + ']';
  }
}
