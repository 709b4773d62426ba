package ca.gc.cra.frametap.infrastructure.persistence.image;

import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.application.port.ImageSinkPort;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.Annotations;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.infrastructure.persistence.io.AtomicFiles;
import ca.gc.cra.frametap.infrastructure.persistence.io.TimestampNames;
import ca.gc.cra.frametap.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link ImageSinkPort} that encodes each frame and publishes it under a timestamped
 * name in the image directory.
 * <p><strong>Why:</strong> Downstream collectors watch the directory; staging under
 * {@code transferring.<name>} keeps them from picking up half-written files.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the subscriber thread.</p>
 * <p><strong>Observability:</strong> Emits {@code subscriber.image.written}, {@code .writeFailed} and
 * {@code .renameFailed}.</p>
 *
 * @since 0.1.0
 */
public final class ImageFileWriter implements ImageSinkPort {
  private static final Logger log = LoggerFactory.getLogger(ImageFileWriter.class);

  private final Path directory;
  private final ImageCodec codec;
  private final ImageFormat format;
  private final int quality;
  private final String fileIdKey;
  private final TimestampNames names;
  private final MetricsPort metrics;

  /**
   * Creates an image writer.
   *
   * @param directory existing output directory
   * @param codec pixel encoder
   * @param format output container
   * @param quality JPEG quality 1..100; ignored for PNG
   * @param fileIdKey dot-separated annotation path naming the file id
   * @param zone zone for timestamp rendering
   * @param metrics metrics sink
   */
  public ImageFileWriter(
      Path directory,
      ImageCodec codec,
      ImageFormat format,
      int quality,
      String fileIdKey,
      ZoneId zone,
      MetricsPort metrics) {
    this.directory = Objects.requireNonNull(directory, "directory");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.format = Objects.requireNonNull(format, "format");
    this.quality = quality;
    this.fileIdKey = Objects.requireNonNull(fileIdKey, "fileIdKey");
    this.names = new TimestampNames(Objects.requireNonNull(zone, "zone"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public boolean write(Envelope envelope) {
    if (!(envelope.payload() instanceof ImagePayload image)) {
      log.debug("Ignoring non-image payload from {}", envelope.sourceId());
      return false;
    }
    Path target;
    Path temp;
    try {
      target = directory.resolve(fileNameFor(envelope));
      temp = AtomicFiles.tempSibling(target);
    } catch (InvalidPathException ex) {
      metrics.increment("subscriber.image.writeFailed");
      log.warn("Cannot name image from {}: {}", Logs.truncate(envelope.sourceId(), 64), ex.getMessage());
      return false;
    }
    try {
      Files.write(temp, codec.encode(image, format, quality));
    } catch (IOException ex) {
      metrics.increment("subscriber.image.writeFailed");
      log.warn("Failed to write image {}: {}", temp.getFileName(), ex.getMessage());
      AtomicFiles.deleteQuietly(temp);
      return false;
    }
    try {
      AtomicFiles.publish(temp, target);
    } catch (IOException ex) {
      metrics.increment("subscriber.image.renameFailed");
      log.warn("Failed to publish image {}: {}", target.getFileName(), ex.toString());
      AtomicFiles.deleteQuietly(temp);
      return false;
    }
    metrics.increment("subscriber.image.written");
    log.debug("Wrote image {}", target.getFileName());
    return true;
  }

  /**
   * Computes the final file name for an envelope.
   *
   * @param envelope image envelope
   * @return file name without directory
   */
  String fileNameFor(Envelope envelope) {
    return names.imageName(envelope.frameTime(), resolveFileId(envelope), format);
  }

  /**
   * Resolves the file id from the annotation, falling back to the source id when the path is missing,
   * not textual, or sanitizes to nothing.
   *
   * @param envelope envelope carrying the annotation
   * @return sanitized id
   */
  String resolveFileId(Envelope envelope) {
    MappingValue annotation =
        Annotations.withReservedKeys(envelope.annotation(), envelope.sourceId(), envelope.frameTime());
    return Annotations.resolveText(annotation, fileIdKey)
        .map(TimestampNames::sanitize)
        .filter(id -> !id.isEmpty())
        .orElseGet(() -> TimestampNames.sanitize(envelope.sourceId()));
  }
}
