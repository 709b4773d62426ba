package ca.gc.cra.frametap.domain.frame;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import org.junit.jupiter.api.Test;

class FrameModelTest {

  @Test
  void topicsResolveFromWireNames() {
    assertEquals(FrameTopic.VIDEO, FrameTopic.fromWireName("VideoFrame"));
    assertEquals(FrameTopic.JPEG, FrameTopic.fromWireName("JpegFrame"));
    assertEquals(FrameTopic.LOG, FrameTopic.fromWireName("LogFrame"));
    assertEquals(FrameTopic.UNKNOWN, FrameTopic.fromWireName("AudioFrame"));
    assertEquals(FrameTopic.UNKNOWN, FrameTopic.fromWireName(""));
    assertEquals(FrameTopic.UNKNOWN, FrameTopic.fromWireName(null));
  }

  @Test
  void partCountsMatchWireLayout() {
    assertEquals(6, FrameTopic.VIDEO.partCount());
    assertEquals(6, FrameTopic.JPEG.partCount());
    assertEquals(4, FrameTopic.LOG.partCount());
  }

  @Test
  void imagePayloadExposesGeometry() {
    ImagePayload image = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT16, new int[] {4, 6, 3}, new byte[144], MappingValue.EMPTY);

    assertEquals(4, image.height());
    assertEquals(6, image.width());
    assertEquals(3, image.channels());
    assertEquals(144, image.expectedRawLength());
  }

  @Test
  void grayImageHasOneChannel() {
    ImagePayload image = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {2, 2}, new byte[4], MappingValue.EMPTY);
    assertEquals(1, image.channels());
  }

  @Test
  void imagePayloadRejectsBadShapes() {
    assertThrows(IllegalArgumentException.class, () -> new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {4}, new byte[4], MappingValue.EMPTY));
    assertThrows(IllegalArgumentException.class, () -> new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {4, 0}, new byte[0], MappingValue.EMPTY));
  }

  @Test
  void imagePayloadEqualityComparesContents() {
    ImagePayload a = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {1, 2}, new byte[] {1, 2}, MappingValue.EMPTY);
    ImagePayload b = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {1, 2}, new byte[] {1, 2}, MappingValue.EMPTY);
    ImagePayload c = new ImagePayload(
        PixelEncoding.RAW, PixelType.UINT8, new int[] {1, 2}, new byte[] {1, 3}, MappingValue.EMPTY);

    assertEquals(a, b);
    assertEquals(a.hashCode(), b.hashCode());
    assertNotEquals(a, c);
  }

  @Test
  void pixelTypeAndImageFormatParseLabels() {
    assertEquals(PixelType.FLOAT32, PixelType.fromLabel(" Float32 "));
    assertThrows(IllegalArgumentException.class, () -> PixelType.fromLabel("complex64"));
    assertEquals(ImageFormat.JPEG, ImageFormat.fromString(null));
    assertEquals(ImageFormat.PNG, ImageFormat.fromString("PNG"));
    assertThrows(IllegalArgumentException.class, () -> ImageFormat.fromString("tiff"));
  }
}
