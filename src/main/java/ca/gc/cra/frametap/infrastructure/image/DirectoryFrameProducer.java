package ca.gc.cra.frametap.infrastructure.image;

import ca.gc.cra.frametap.application.port.FrameProducer;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import javax.imageio.ImageIO;

/**
 * Cycles through the JPEG and PNG files of a directory in name order.
 *
 * @since 0.1.0
 */
public final class DirectoryFrameProducer implements FrameProducer {
  private final List<Path> files;

  /**
   * Scans a directory for images.
   *
   * @param directory directory holding {@code .jpg}, {@code .jpeg} or {@code .png} files
   * @throws IOException if the directory cannot be listed or holds no images
   */
  public DirectoryFrameProducer(Path directory) throws IOException {
    if (!Files.isDirectory(directory)) {
      throw new IOException("Not a directory: " + directory);
    }
    try (Stream<Path> stream = Files.list(directory)) {
      files = stream
          .filter(Files::isRegularFile)
          .filter(DirectoryFrameProducer::isImage)
          .sorted()
          .collect(Collectors.toList());
    }
    if (files.isEmpty()) {
      throw new IOException("No .jpg or .png images in " + directory);
    }
  }

  /**
   * Returns the number of images cycled through.
   *
   * @return image count
   */
  public int size() {
    return files.size();
  }

  @Override
  public ImagePayload next(long sequence) throws IOException {
    Path file = files.get((int) (sequence % files.size()));
    BufferedImage image = ImageIO.read(file.toFile());
    if (image == null) {
      throw new IOException("Unreadable image " + file.getFileName());
    }
    MappingValue annotation = MappingValue.EMPTY.with("file", new TextValue(file.getFileName().toString()));
    return ImageIoCodec.toRaw(image, annotation);
  }

  private static boolean isImage(Path path) {
    Path name = path.getFileName();
    if (name == null) {
      return false;
    }
    String lower = name.toString().toLowerCase(Locale.ROOT);
    return lower.endsWith(".jpg") || lower.endsWith(".jpeg") || lower.endsWith(".png");
  }
}
