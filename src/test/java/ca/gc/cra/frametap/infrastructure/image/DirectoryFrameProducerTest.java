package ca.gc.cra.frametap.infrastructure.image;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class DirectoryFrameProducerTest {

  @TempDir Path tempDir;

  @Test
  void cyclesImagesInNameOrder() throws IOException {
    ImageIoCodec codec = new ImageIoCodec();
    Files.write(tempDir.resolve("b.png"),
        codec.encode(ImageIoCodecTest.solidBgr(3, 2, (byte) 0, (byte) 0, (byte) 0), ImageFormat.PNG, 95));
    Files.write(tempDir.resolve("a.png"),
        codec.encode(ImageIoCodecTest.solidBgr(4, 4, (byte) 9, (byte) 9, (byte) 9), ImageFormat.PNG, 95));
    Files.writeString(tempDir.resolve("notes.txt"), "ignored");

    DirectoryFrameProducer producer = new DirectoryFrameProducer(tempDir);

    assertEquals(2, producer.size());
    ImagePayload first = producer.next(0);
    assertEquals(new TextValue("a.png"), first.annotation().entries().get("file"));
    assertArrayEquals(new int[] {4, 4, 3}, first.shape());
    assertEquals(new TextValue("b.png"), producer.next(1).annotation().entries().get("file"));
    assertEquals(new TextValue("a.png"), producer.next(2).annotation().entries().get("file"));
  }

  @Test
  void directoryWithoutImagesIsRejected() throws IOException {
    Files.writeString(tempDir.resolve("readme.md"), "none");
    assertThrows(IOException.class, () -> new DirectoryFrameProducer(tempDir));
  }

  @Test
  void missingDirectoryIsRejected() {
    assertThrows(IOException.class, () -> new DirectoryFrameProducer(tempDir.resolve("absent")));
  }

  @Test
  void unreadableImageFailsOnNext() throws IOException {
    Files.writeString(tempDir.resolve("broken.jpg"), "not really a jpeg");
    DirectoryFrameProducer producer = new DirectoryFrameProducer(tempDir);
    assertThrows(IOException.class, () -> producer.next(0));
  }
}
