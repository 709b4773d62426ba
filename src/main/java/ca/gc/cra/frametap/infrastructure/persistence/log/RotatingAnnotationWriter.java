package ca.gc.cra.frametap.infrastructure.persistence.log;

import ca.gc.cra.frametap.application.port.AnnotationSinkPort;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.application.port.PersistenceException;
import ca.gc.cra.frametap.application.port.PersistenceException.Kind;
import ca.gc.cra.frametap.domain.annotation.AnnotationFlattener;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.infrastructure.persistence.io.AtomicFiles;
import ca.gc.cra.frametap.infrastructure.persistence.io.TimestampNames;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link AnnotationSinkPort} that batches records into time-bounded files.
 * <p><strong>Why:</strong> Collectors ingest whole files; a window groups consecutive records and is
 * renamed onto its final name only once it is closed.</p>
 * <p><strong>Lifecycle:</strong> the first record after a closed window opens
 * {@code transferring.<start><ext>}; {@link #rotateIfExpired(double)} closes it once
 * {@code now > start + interval}; {@link #close()} force-closes at shutdown.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; owned by the subscriber thread. At most one window is
 * open at a time.</p>
 * <p><strong>Observability:</strong> Emits {@code subscriber.log.appended}, {@code .writeFailed},
 * {@code .published} and {@code .renameFailed}.</p>
 *
 * @since 0.1.0
 */
public final class RotatingAnnotationWriter implements AnnotationSinkPort {
  private static final Logger log = LoggerFactory.getLogger(RotatingAnnotationWriter.class);

  private final Path directory;
  private final AnnotationFormat format;
  private final double intervalSeconds;
  private final boolean flatten;
  private final TimestampNames names;
  private final MetricsPort metrics;

  private Window window;

  /**
   * Creates a rotating writer.
   *
   * @param directory existing log directory
   * @param format record serialization
   * @param intervalSeconds window length in seconds; must be positive
   * @param flatten whether nested records are flattened before writing
   * @param zone zone for file-name timestamps
   * @param metrics metrics sink
   */
  public RotatingAnnotationWriter(
      Path directory,
      AnnotationFormat format,
      double intervalSeconds,
      boolean flatten,
      ZoneId zone,
      MetricsPort metrics) {
    if (!(intervalSeconds > 0d)) {
      throw new IllegalArgumentException("intervalSeconds must be positive (was " + intervalSeconds + ")");
    }
    this.directory = Objects.requireNonNull(directory, "directory");
    this.format = Objects.requireNonNull(format, "format");
    this.intervalSeconds = intervalSeconds;
    this.flatten = flatten;
    this.names = new TimestampNames(Objects.requireNonNull(zone, "zone"));
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  @Override
  public void append(double frameTime, MappingValue record) throws PersistenceException {
    Objects.requireNonNull(record, "record");
    if (window == null) {
      window = open(frameTime);
    }
    MappingValue out = flatten ? AnnotationFlattener.flatten(record) : record;
    try {
      format.writeRecord(window.out(), out);
      window.out().flush();
    } catch (IOException ex) {
      metrics.increment("subscriber.log.writeFailed");
      throw new PersistenceException(Kind.WRITE_FAILED, "append to " + window.temp().getFileName() + " failed", ex);
    }
    metrics.increment("subscriber.log.appended");
  }

  @Override
  public void rotateIfExpired(double now) {
    if (window != null && now > window.startTime() + intervalSeconds) {
      closeWindow();
    }
  }

  @Override
  public void close() {
    closeWindow();
  }

  /**
   * Returns the staging path of the open window, if any.
   *
   * @return open window's temp path
   */
  Optional<Path> openWindowPath() {
    return Optional.ofNullable(window).map(Window::temp);
  }

  private Window open(double startTime) throws PersistenceException {
    Path target = directory.resolve(names.format(startTime) + format.extension());
    Path temp = AtomicFiles.tempSibling(target);
    Writer out = null;
    try {
      out = Files.newBufferedWriter(temp, StandardCharsets.UTF_8);
      format.writeHeader(out);
      out.flush();
    } catch (IOException ex) {
      metrics.increment("subscriber.log.writeFailed");
      closeQuietly(out, temp);
      AtomicFiles.deleteQuietly(temp);
      throw new PersistenceException(Kind.WRITE_FAILED, "cannot open " + temp.getFileName(), ex);
    }
    log.debug("Opened log window {}", temp.getFileName());
    return new Window(startTime, temp, target, out);
  }

  private void closeWindow() {
    Window current = window;
    if (current == null) {
      return;
    }
    window = null;
    try {
      current.out().close();
    } catch (IOException ex) {
      metrics.increment("subscriber.log.writeFailed");
      log.warn("Failed to close log window {}: {}", current.temp().getFileName(), ex.getMessage());
    }
    try {
      AtomicFiles.publish(current.temp(), current.target());
      metrics.increment("subscriber.log.published");
      log.info("Published log file {}", current.target().getFileName());
    } catch (IOException ex) {
      metrics.increment("subscriber.log.renameFailed");
      log.warn("Failed to publish log file {}: {}", current.target().getFileName(), ex.toString());
      AtomicFiles.deleteQuietly(current.temp());
    }
  }

  private static void closeQuietly(Writer out, Path temp) {
    if (out == null) {
      return;
    }
    try {
      out.close();
    } catch (IOException ex) {
      log.debug("Error closing {}", temp, ex);
    }
  }

  private record Window(double startTime, Path temp, Path target, Writer out) {}
}
