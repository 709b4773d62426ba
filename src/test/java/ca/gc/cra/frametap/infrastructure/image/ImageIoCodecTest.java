package ca.gc.cra.frametap.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.util.Arrays;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;

class ImageIoCodecTest {

  private final ImageIoCodec codec = new ImageIoCodec();

  @Test
  void jpegEncodeThenDecodeKeepsGeometryAndAnnotation() throws IOException {
    MappingValue annotation = MappingValue.EMPTY.with("k", new TextValue("v"));
    ImagePayload raw = solidBgr(16, 8, (byte) 40, (byte) 120, (byte) 200);

    byte[] jpeg = codec.encode(raw, ImageFormat.JPEG, 95);
    assertEquals((byte) 0xFF, jpeg[0]);
    assertEquals((byte) 0xD8, jpeg[1]);

    ImagePayload decoded = codec.decodeJpeg(new ImagePayload(
        PixelEncoding.JPEG, PixelType.UINT8, raw.shape(), jpeg, annotation));

    assertEquals(PixelEncoding.RAW, decoded.encoding());
    assertArrayEquals(new int[] {8, 16, 3}, decoded.shape());
    assertEquals(annotation, decoded.annotation());
    assertTrue(Math.abs((decoded.data()[0] & 0xFF) - 40) < 12);
    assertTrue(Math.abs((decoded.data()[2] & 0xFF) - 200) < 12);
  }

  @Test
  void grayscaleStaysSingleChannel() throws IOException {
    byte[] data = new byte[8 * 8];
    Arrays.fill(data, (byte) 90);
    ImagePayload gray = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {8, 8}, data, MappingValue.EMPTY);

    byte[] jpeg = codec.encode(gray, ImageFormat.JPEG, 90);
    ImagePayload decoded = codec.decodeJpeg(new ImagePayload(
        PixelEncoding.JPEG, PixelType.UINT8, gray.shape(), jpeg, MappingValue.EMPTY));

    assertArrayEquals(new int[] {8, 8}, decoded.shape());
    assertEquals(1, decoded.channels());
  }

  @Test
  void pngEncodingIsLossless() throws IOException {
    ImagePayload raw = solidBgr(4, 3, (byte) 1, (byte) 2, (byte) 3);

    byte[] png = codec.encode(raw, ImageFormat.PNG, 95);
    BufferedImage read = ImageIO.read(new ByteArrayInputStream(png));

    assertArrayEquals(raw.data(), ImageIoCodec.toRaw(read, MappingValue.EMPTY).data());
  }

  @Test
  void garbageBufferIsNotAJpeg() {
    ImagePayload bogus = new ImagePayload(
        PixelEncoding.JPEG, PixelType.UINT8, new int[] {2, 2, 3}, new byte[] {1, 2, 3, 4}, MappingValue.EMPTY);
    assertThrows(IOException.class, () -> codec.decodeJpeg(bogus));
  }

  @Test
  void encodeRejectsUnsupportedLayouts() {
    ImagePayload rgba = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {2, 2, 4}, new byte[16], MappingValue.EMPTY);
    ImagePayload wide = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT16, new int[] {2, 2}, new byte[8], MappingValue.EMPTY);
    ImagePayload truncated = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {2, 2, 3}, new byte[5], MappingValue.EMPTY);

    assertThrows(IOException.class, () -> codec.encode(rgba, ImageFormat.JPEG, 90));
    assertThrows(IOException.class, () -> codec.encode(wide, ImageFormat.PNG, 90));
    assertThrows(IOException.class, () -> codec.encode(truncated, ImageFormat.PNG, 90));
  }

  @Test
  void testPatternProducesBgrFrames() throws IOException {
    TestPatternProducer producer = new TestPatternProducer(5, 4);
    ImagePayload frame = producer.next(7);

    assertArrayEquals(new int[] {4, 5, 3}, frame.shape());
    assertEquals(frame.expectedRawLength(), frame.data().length);
    assertEquals(new TextValue("gradient"), frame.annotation().entries().get("pattern"));
    assertTrue(codec.encode(frame, ImageFormat.JPEG, 50).length > 0);
  }

  static ImagePayload solidBgr(int width, int height, byte b, byte g, byte r) {
    byte[] data = new byte[width * height * 3];
    for (int i = 0; i < data.length; i += 3) {
      data[i] = b;
      data[i + 1] = g;
      data[i + 2] = r;
    }
    return new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {height, width, 3}, data, MappingValue.EMPTY);
  }
}
