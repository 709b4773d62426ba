package ca.gc.cra.frametap.infrastructure.image;

import ca.gc.cra.frametap.application.port.FrameProducer;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import ca.gc.cra.frametap.validation.Numbers;

/**
 * Generates a scrolling BGR gradient so subscribers have something to show without an image directory.
 *
 * @since 0.1.0
 */
public final class TestPatternProducer implements FrameProducer {
  private final int width;
  private final int height;
  private final MappingValue annotation;

  /**
   * Creates a generator.
   *
   * @param width frame width in pixels, 1..4096
   * @param height frame height in pixels, 1..4096
   */
  public TestPatternProducer(int width, int height) {
    this.width = (int) Numbers.requireRange("width", width, 1, 4096);
    this.height = (int) Numbers.requireRange("height", height, 1, 4096);
    this.annotation = MappingValue.EMPTY
        .with("pattern", new TextValue("gradient"))
        .with("width", new NumberValue(width))
        .with("height", new NumberValue(height));
  }

  @Override
  public ImagePayload next(long sequence) {
    byte[] data = new byte[width * height * 3];
    int shift = (int) (sequence % 256);
    int i = 0;
    for (int y = 0; y < height; y++) {
      for (int x = 0; x < width; x++) {
        data[i++] = (byte) ((x + shift) * 255 / Math.max(1, width - 1));
        data[i++] = (byte) (y * 255 / Math.max(1, height - 1));
        data[i++] = (byte) shift;
      }
    }
    return new ImagePayload(PixelEncoding.RAW, PixelType.UINT8, new int[] {height, width, 3}, data, annotation);
  }
}
