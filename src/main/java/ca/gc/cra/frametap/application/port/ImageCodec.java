package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.io.IOException;

/**
 * Pixel-level conversions needed by the router, the image writer, and the publisher.
 *
 * @since 0.1.0
 */
public interface ImageCodec {
  /**
   * Decodes a JPEG payload into a raw uint8 payload ({@code [h,w,3]} BGR or {@code [h,w]} grayscale).
   *
   * @param jpeg payload with {@code JPEG} encoding
   * @return raw payload carrying the same annotation
   * @throws IOException if the bitstream cannot be decoded
   */
  ImagePayload decodeJpeg(ImagePayload jpeg) throws IOException;

  /**
   * Encodes a raw uint8 payload with one or three channels into a file format.
   *
   * @param raw raw payload
   * @param format target container
   * @param quality JPEG quality 1..100; ignored for lossless formats
   * @return encoded bytes
   * @throws IOException if the payload cannot be represented or the encoder fails
   */
  byte[] encode(ImagePayload raw, ImageFormat format, int quality) throws IOException;
}
