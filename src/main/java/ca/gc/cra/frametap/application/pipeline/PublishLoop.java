package ca.gc.cra.frametap.application.pipeline;

import ca.gc.cra.frametap.application.port.ClockPort;
import ca.gc.cra.frametap.application.port.FrameCodec;
import ca.gc.cra.frametap.application.port.FrameProducer;
import ca.gc.cra.frametap.application.port.FramePublisher;
import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.LogPayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import ca.gc.cra.frametap.validation.Numbers;
import ca.gc.cra.frametap.validation.Strings;
import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Reference publisher that pulls images from a {@link FrameProducer}, optionally
 * JPEG-compresses them, and publishes wire frames at a target rate.
 * <p><strong>Why:</strong> Exercises subscribers end to end without a camera pipeline.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; run on one thread.</p>
 * <p><strong>Observability:</strong> Emits {@code publisher.sent} and {@code publisher.failed}.</p>
 *
 * @since 0.1.0
 */
public final class PublishLoop {
  private static final Logger log = LoggerFactory.getLogger(PublishLoop.class);

  private final FrameProducer producer;
  private final ImageCodec imageCodec;
  private final FrameCodec codec;
  private final FramePublisher publisher;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;

  /**
   * Creates a publish loop.
   *
   * @param producer image source
   * @param imageCodec JPEG encoder
   * @param codec wire codec
   * @param publisher transport publisher
   * @param clock wall clock used for {@code frame_time}
   * @param metrics metrics sink
   * @param settings publishing options
   */
  public PublishLoop(
      FrameProducer producer,
      ImageCodec imageCodec,
      FrameCodec codec,
      FramePublisher publisher,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings) {
    this.producer = Objects.requireNonNull(producer, "producer");
    this.imageCodec = Objects.requireNonNull(imageCodec, "imageCodec");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.publisher = Objects.requireNonNull(publisher, "publisher");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Publishes until the token is cancelled or {@code count} frames have been sent.
   *
   * @param token stop signal
   * @return number of image frames published
   * @throws TransportException if the publisher cannot start or a send fails
   */
  public long run(CancellationToken token) throws TransportException {
    Objects.requireNonNull(token, "token");
    long periodNanos = TimeUnit.SECONDS.toNanos(1) / settings.fps();
    long sent = 0;
    try {
      publisher.start();
      log.info("Publishing as '{}' at {} fps ({})", settings.sourceId(), settings.fps(),
          settings.jpeg() ? FrameTopic.JPEG.wireName() : FrameTopic.VIDEO.wireName());
      long deadline = System.nanoTime();
      for (long sequence = 0; !token.isCancelled() && (settings.count() == 0 || sequence < settings.count());
          sequence++) {
        if (publishFrame(sequence)) {
          sent++;
        }
        if (settings.logEvery() > 0 && (sequence + 1) % settings.logEvery() == 0) {
          publishLog(sequence, sent);
        }
        deadline += periodNanos;
        long remaining = deadline - System.nanoTime();
        if (remaining > 0) {
          TimeUnit.NANOSECONDS.sleep(remaining);
        }
      }
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.info("Publisher interrupted");
    } catch (TransportException ex) {
      metrics.increment("publisher.failed");
      log.error("Publisher transport failed after {} frames", sent, ex);
      throw ex;
    } finally {
      try {
        producer.close();
      } catch (RuntimeException ex) {
        log.error("Failed to close frame producer", ex);
      } finally {
        try {
          publisher.close();
          log.info("Publisher closed after {} frames", sent);
        } catch (RuntimeException ex) {
          log.error("Failed to close publisher", ex);
        }
      }
    }
    return sent;
  }

  private boolean publishFrame(long sequence) throws TransportException {
    ImagePayload image;
    try {
      ImagePayload raw = producer.next(sequence);
      MappingValue annotation = raw.annotation().with("sequence", new NumberValue(sequence));
      image = settings.jpeg()
          ? new ImagePayload(PixelEncoding.JPEG, raw.dtype(), raw.shape(),
              imageCodec.encode(raw, ImageFormat.JPEG, settings.jpegQuality()), annotation)
          : new ImagePayload(PixelEncoding.RAW, raw.dtype(), raw.shape(), raw.data(), annotation);
    } catch (IOException ex) {
      metrics.increment("publisher.failed");
      log.warn("Skipping frame {}: {}", sequence, ex.getMessage());
      return false;
    }
    FrameTopic topic = settings.jpeg() ? FrameTopic.JPEG : FrameTopic.VIDEO;
    Envelope envelope = new Envelope(topic, settings.sourceId(), clock.nowSeconds(), image);
    publisher.publish(codec.encode(envelope, settings.topicSuffix()), settings.sourceId());
    metrics.increment("publisher.sent");
    return true;
  }

  private void publishLog(long sequence, long sent) throws TransportException {
    MappingValue annotation = MappingValue.EMPTY
        .with("event", new TextValue("progress"))
        .with("sequence", new NumberValue(sequence))
        .with("sent", new NumberValue(sent));
    Envelope envelope =
        new Envelope(FrameTopic.LOG, settings.sourceId(), clock.nowSeconds(), new LogPayload(annotation));
    publisher.publish(codec.encode(envelope, settings.topicSuffix()), settings.sourceId());
    metrics.increment("publisher.sent");
  }

  /**
   * Publishing options.
   *
   * @param sourceId identifier placed in every frame
   * @param fps target frame rate, 1..240
   * @param jpeg publish {@code JpegFrame} instead of {@code VideoFrame}
   * @param jpegQuality JPEG quality, 1..100
   * @param logEvery emit a {@code LogFrame} every N image frames; {@code 0} disables
   * @param count stop after N frames; {@code 0} runs until cancelled
   * @param topicSuffix append {@code "/" + sourceId} to topics
   */
  public record Settings(
      String sourceId, int fps, boolean jpeg, int jpegQuality, int logEvery, long count, boolean topicSuffix) {
    public Settings {
      sourceId = Strings.requireNonBlank("sourceId", sourceId);
      Numbers.requireRange("fps", fps, 1, 240);
      Numbers.requireRange("jpegQuality", jpegQuality, 1, 100);
      Numbers.requireRange("logEvery", logEvery, 0, Integer.MAX_VALUE);
      Numbers.requireRange("count", count, 0, Long.MAX_VALUE);
    }
  }
}
