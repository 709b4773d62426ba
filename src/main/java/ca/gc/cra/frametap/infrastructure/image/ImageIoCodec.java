package ca.gc.cra.frametap.infrastructure.image;

import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.DataBufferByte;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Iterator;
import java.util.Objects;
import javax.imageio.IIOImage;
import javax.imageio.ImageIO;
import javax.imageio.ImageWriteParam;
import javax.imageio.ImageWriter;
import javax.imageio.stream.ImageOutputStream;

/**
 * {@link ImageCodec} backed by {@code javax.imageio}.
 *
 * <p>Raw pixels are interleaved uint8 in BGR order for three channels, matching
 * {@link BufferedImage#TYPE_3BYTE_BGR}, or a single luminance plane.</p>
 *
 * @since 0.1.0
 */
public final class ImageIoCodec implements ImageCodec {

  @Override
  public ImagePayload decodeJpeg(ImagePayload jpeg) throws IOException {
    Objects.requireNonNull(jpeg, "jpeg");
    BufferedImage decoded = ImageIO.read(new ByteArrayInputStream(jpeg.data()));
    if (decoded == null) {
      throw new IOException("buffer is not a readable JPEG image");
    }
    return toRaw(decoded, jpeg.annotation());
  }

  /**
   * Converts a decoded image into interleaved uint8 pixels.
   *
   * @param decoded image read by ImageIO
   * @param annotation annotation carried by the payload
   * @return raw BGR or grayscale payload
   */
  static ImagePayload toRaw(BufferedImage decoded, MappingValue annotation) {
    boolean gray = decoded.getType() == BufferedImage.TYPE_BYTE_GRAY;
    BufferedImage pixels = convert(decoded, gray ? BufferedImage.TYPE_BYTE_GRAY : BufferedImage.TYPE_3BYTE_BGR);
    byte[] data = ((DataBufferByte) pixels.getRaster().getDataBuffer()).getData();
    int[] shape = gray
        ? new int[] {pixels.getHeight(), pixels.getWidth()}
        : new int[] {pixels.getHeight(), pixels.getWidth(), 3};
    return new ImagePayload(PixelEncoding.RAW, PixelType.UINT8, shape, data, annotation);
  }

  @Override
  public byte[] encode(ImagePayload raw, ImageFormat format, int quality) throws IOException {
    Objects.requireNonNull(raw, "raw");
    Objects.requireNonNull(format, "format");
    BufferedImage image = toBufferedImage(raw);
    ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(1024, raw.data().length / 4));
    if (format == ImageFormat.JPEG) {
      writeJpeg(image, out, quality);
    } else if (!ImageIO.write(image, format.imageIoName(), out)) {
      throw new IOException("no ImageIO writer for " + format.imageIoName());
    }
    return out.toByteArray();
  }

  static BufferedImage toBufferedImage(ImagePayload raw) throws IOException {
    if (raw.encoding() != PixelEncoding.RAW) {
      throw new IOException("expected raw pixels (was " + raw.encoding() + ")");
    }
    if (raw.dtype() != PixelType.UINT8) {
      throw new IOException("only uint8 images can be encoded (was " + raw.dtype().label() + ")");
    }
    int channels = raw.channels();
    int type;
    if (channels == 1) {
      type = BufferedImage.TYPE_BYTE_GRAY;
    } else if (channels == 3) {
      type = BufferedImage.TYPE_3BYTE_BGR;
    } else {
      throw new IOException("only 1 or 3 channel images can be encoded (was " + channels + ")");
    }
    if (raw.data().length != raw.expectedRawLength()) {
      throw new IOException("pixel buffer holds " + raw.data().length
          + " bytes but shape requires " + raw.expectedRawLength());
    }
    BufferedImage image = new BufferedImage(raw.width(), raw.height(), type);
    byte[] target = ((DataBufferByte) image.getRaster().getDataBuffer()).getData();
    System.arraycopy(raw.data(), 0, target, 0, target.length);
    return image;
  }

  private static void writeJpeg(BufferedImage image, ByteArrayOutputStream out, int quality) throws IOException {
    if (quality < 1 || quality > 100) {
      throw new IOException("JPEG quality must be between 1 and 100 (was " + quality + ")");
    }
    Iterator<ImageWriter> writers = ImageIO.getImageWritersByFormatName("jpg");
    if (!writers.hasNext()) {
      throw new IOException("no ImageIO writer for jpg");
    }
    ImageWriter writer = writers.next();
    ImageWriteParam param = writer.getDefaultWriteParam();
    param.setCompressionMode(ImageWriteParam.MODE_EXPLICIT);
    param.setCompressionQuality(quality / 100f);
    try (ImageOutputStream ios = ImageIO.createImageOutputStream(out)) {
      writer.setOutput(ios);
      writer.write(null, new IIOImage(image, null, null), param);
    } finally {
      writer.dispose();
    }
  }

  private static BufferedImage convert(BufferedImage source, int type) {
    BufferedImage converted = new BufferedImage(source.getWidth(), source.getHeight(), type);
    Graphics2D g = converted.createGraphics();
    try {
      g.drawImage(source, 0, 0, null);
    } finally {
      g.dispose();
    }
    return converted;
  }
}
