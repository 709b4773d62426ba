package ca.gc.cra.frametap.infrastructure.persistence.image;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.LogPayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.domain.frame.PixelType;
import ca.gc.cra.frametap.infrastructure.image.ImageIoCodec;
import ca.gc.cra.frametap.testutil.RecordingMetricsPort;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ImageFileWriterTest {

  @TempDir Path tempDir;

  private final RecordingMetricsPort metrics = new RecordingMetricsPort();

  @Test
  void writesJpegNamedByTimestampAndAnnotationId() throws IOException {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.JPEG, "camera.serial");
    Envelope envelope = video("cam 1", 10.5, Map.of("camera", Map.of("serial", "SN 42/a")));

    assertTrue(writer.write(envelope));

    Path expected = tempDir.resolve("1970-01-01_00:00:10.500+0000_SN42a.jpg");
    assertTrue(Files.exists(expected));
    assertEquals(8, ImageIO.read(expected.toFile()).getWidth());
    assertEquals(List.of(expected.getFileName().toString()), listNames());
    assertEquals(1, metrics.count("subscriber.image.written"));
  }

  @Test
  void missingIdFallsBackToSanitizedSourceId() {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.PNG, "serial");
    Envelope envelope = video("front door", 0.0, Map.of("serial", 7));

    assertEquals("frontdoor", writer.resolveFileId(envelope));
    assertEquals("1970-01-01_00:00:00.000+0000_frontdoor.png", writer.fileNameFor(envelope));
  }

  @Test
  void nulCharactersNeverReachTheFileName() throws IOException {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.PNG, "serial");
    Envelope envelope = video("cam\u0000a", 1.0, Map.of("serial", "\u0000"));

    assertTrue(writer.write(envelope));

    assertEquals(List.of("1970-01-01_00:00:01.000+0000_cama.png"), listNames());
    assertEquals(1, metrics.count("subscriber.image.written"));
  }

  @Test
  void reservedSourceIdKeyResolvesByDefault() {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.JPEG, "source_id");
    assertEquals("srcA", writer.resolveFileId(video("srcA", 1.0, Map.of())));
  }

  @Test
  void encodeFailureLeavesNoStagingFile() throws IOException {
    ImageCodec failing = new ImageCodec() {
      @Override
      public ImagePayload decodeJpeg(ImagePayload jpeg) throws IOException {
        throw new IOException("unused");
      }

      @Override
      public byte[] encode(ImagePayload raw, ImageFormat format, int quality) throws IOException {
        throw new IOException("encoder exploded");
      }
    };
    ImageFileWriter writer = writer(failing, ImageFormat.JPEG, "source_id");

    assertFalse(writer.write(video("srcA", 1.0, Map.of())));
    assertTrue(listNames().isEmpty());
    assertEquals(1, metrics.count("subscriber.image.writeFailed"));
  }

  @Test
  void existingTargetIsNeverOverwritten() throws IOException {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.PNG, "source_id");
    Envelope envelope = video("srcA", 2.0, Map.of());
    Path target = Files.writeString(tempDir.resolve(writer.fileNameFor(envelope)), "keep");

    assertFalse(writer.write(envelope));

    assertEquals("keep", Files.readString(target));
    assertEquals(List.of(target.getFileName().toString()), listNames());
    assertEquals(1, metrics.count("subscriber.image.renameFailed"));
  }

  @Test
  void logPayloadIsIgnored() {
    ImageFileWriter writer = writer(new ImageIoCodec(), ImageFormat.JPEG, "source_id");
    Envelope log = new Envelope(FrameTopic.LOG, "srcA", 1.0, new LogPayload(MappingValue.EMPTY));
    assertFalse(writer.write(log));
  }

  private ImageFileWriter writer(ImageCodec codec, ImageFormat format, String fileIdKey) {
    return new ImageFileWriter(tempDir, codec, format, 90, fileIdKey, ZoneOffset.UTC, metrics);
  }

  private static Envelope video(String sourceId, double frameTime, Map<String, Object> annotation) {
    ImagePayload image = new ImagePayload(PixelEncoding.RAW, PixelType.UINT8, new int[] {4, 8, 3}, new byte[96],
        (MappingValue) AnnotationValue.fromJava(annotation));
    return new Envelope(FrameTopic.VIDEO, sourceId, frameTime, image);
  }

  private List<String> listNames() throws IOException {
    try (Stream<Path> files = Files.list(tempDir)) {
      return files.map(path -> path.getFileName().toString()).sorted().collect(Collectors.toList());
    }
  }
}
