package ca.gc.cra.frametap.domain.frame;

/**
 * How the bytes of an {@link ImagePayload} are laid out.
 *
 * @since 0.1.0
 */
public enum PixelEncoding {
  /** Row-major pixel array described by dtype and shape. */
  RAW,
  /** JPEG bitstream; dtype and shape describe the image before compression. */
  JPEG
}
