package ca.gc.cra.frametap.application.pipeline;

import ca.gc.cra.frametap.application.flow.DisplayFrame;
import ca.gc.cra.frametap.application.flow.HandoffQueue;
import ca.gc.cra.frametap.application.flow.InhibitionGate;
import ca.gc.cra.frametap.application.flow.StatsSnapshot;
import ca.gc.cra.frametap.application.flow.StatsTracker;
import ca.gc.cra.frametap.application.port.AnnotationSinkPort;
import ca.gc.cra.frametap.application.port.ClockPort;
import ca.gc.cra.frametap.application.port.DecodeException;
import ca.gc.cra.frametap.application.port.FrameCodec;
import ca.gc.cra.frametap.application.port.FrameSource;
import ca.gc.cra.frametap.application.port.ImageSinkPort;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.application.port.PersistenceException;
import ca.gc.cra.frametap.application.port.RecordEchoPort;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.Annotations;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;
import ca.gc.cra.frametap.validation.Numbers;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Network-thread loop that polls a {@link FrameSource}, decodes and routes each
 * message, tracks statistics, and fans frames out to persistence and display.
 * <p><strong>Why:</strong> Shared by the {@code view} and {@code record} commands; the two differ only in
 * which sinks and queues are wired.</p>
 * <p><strong>Role:</strong> Application-layer use case on the subscriber side.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Never block on display: images are offered to a bounded {@link HandoffQueue}.</li>
 *   <li>Rate-limit persistence through an {@link InhibitionGate}.</li>
 *   <li>Rotate the annotation window and report stats after every poll, with or without a message.</li>
 *   <li>Count and drop malformed frames without stopping.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; {@link #run(CancellationToken)} owns the source, the
 * gate, the stats, and the annotation window for its whole lifetime.</p>
 * <p><strong>Observability:</strong> Emits {@code subscriber.*} metrics and sets MDC key {@code sourceId}
 * while a frame is being persisted or enqueued.</p>
 *
 * @since 0.1.0
 */
public final class SubscriberLoop {
  private static final Logger log = LoggerFactory.getLogger(SubscriberLoop.class);
  private static final String MDC_SOURCE = "sourceId";

  private final FrameSource source;
  private final FrameCodec codec;
  private final TopicRouter router;
  private final ImageSinkPort imageSink;
  private final AnnotationSinkPort annotationSink;
  private final HandoffQueue<DisplayFrame> displayQueue;
  private final RecordEchoPort echo;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final Settings settings;

  /**
   * Creates a subscriber loop.
   *
   * @param source transport source
   * @param codec wire codec
   * @param router topic router
   * @param imageSink image persistence; {@code null} when no image directory is configured
   * @param annotationSink annotation persistence; {@code null} when no log directory is configured
   * @param displayQueue handoff to the render thread; {@code null} when display is off
   * @param echo console echo for log frames; {@link RecordEchoPort#SILENT} in quiet mode
   * @param clock wall clock
   * @param metrics metrics sink
   * @param settings loop tuning
   */
  public SubscriberLoop(
      FrameSource source,
      FrameCodec codec,
      TopicRouter router,
      ImageSinkPort imageSink,
      AnnotationSinkPort annotationSink,
      HandoffQueue<DisplayFrame> displayQueue,
      RecordEchoPort echo,
      ClockPort clock,
      MetricsPort metrics,
      Settings settings) {
    this.source = Objects.requireNonNull(source, "source");
    this.codec = Objects.requireNonNull(codec, "codec");
    this.router = Objects.requireNonNull(router, "router");
    this.imageSink = imageSink;
    this.annotationSink = annotationSink;
    this.displayQueue = displayQueue;
    this.echo = Objects.requireNonNull(echo, "echo");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.settings = Objects.requireNonNull(settings, "settings");
  }

  /**
   * Runs until the token is cancelled or the transport fails.
   *
   * @param token stop signal checked once per iteration
   * @throws TransportException if the source cannot start or a poll fails
   */
  public void run(CancellationToken token) throws TransportException {
    Objects.requireNonNull(token, "token");
    StatsTracker stats = new StatsTracker(settings.statsIntervalSeconds(), clock.nowSeconds());
    InhibitionGate gate = new InhibitionGate(settings.inhibitSeconds());
    boolean started = false;
    long handled = 0;
    try {
      source.start();
      started = true;
      log.info("Subscriber source started (persist={}, display={})", persistenceEnabled(), displayQueue != null);

      while (!token.isCancelled() && !Thread.currentThread().isInterrupted()) {
        Optional<MultipartMessage> message = source.poll();
        if (message.isPresent()) {
          handle(message.get(), stats, gate);
          handled++;
        }
        double now = clock.nowSeconds();
        if (annotationSink != null) {
          annotationSink.rotateIfExpired(now);
        }
        stats.maybeReport(now).ifPresent(this::report);
      }
      log.info("Subscriber loop stopping after {} messages", handled);
    } catch (TransportException ex) {
      log.error("Subscriber transport failed after {} messages", handled, ex);
      throw ex;
    } finally {
      try {
        if (annotationSink != null) {
          annotationSink.close();
          log.info("Annotation sink closed");
        }
      } catch (RuntimeException ex) {
        log.error("Failed to close annotation sink", ex);
      } finally {
        if (started) {
          try {
            source.close();
            log.info("Subscriber source closed");
          } catch (RuntimeException ex) {
            log.error("Failed to close subscriber source", ex);
          }
        }
      }
    }
  }

  private void handle(MultipartMessage message, StatsTracker stats, InhibitionGate gate) {
    stats.onReceived();
    metrics.increment("subscriber.received");
    Envelope envelope;
    try {
      Optional<Envelope> routed = router.route(codec.decode(message));
      if (routed.isEmpty()) {
        drop(stats);
        return;
      }
      envelope = routed.get();
    } catch (DecodeException ex) {
      metrics.increment("subscriber.decode." + ex.stage().metricSuffix());
      drop(stats);
      log.debug("Dropped {}-part message ({}): {}", message.size(), ex.stage(), ex.getMessage());
      return;
    }

    double now = clock.nowSeconds();
    stats.addDelay(now, envelope.frameTime());
    MappingValue record =
        Annotations.withReservedKeys(envelope.annotation(), envelope.sourceId(), envelope.frameTime());

    String previousSource = MDC.get(MDC_SOURCE);
    try {
      MDC.put(MDC_SOURCE, envelope.sourceId());
      if (isPersistable(envelope)) {
        if (gate.tryAcquire(now)) {
          persist(envelope, record);
        } else {
          metrics.increment("subscriber.persist.inhibited");
        }
      }
      if (displayQueue != null && envelope.payload() instanceof ImagePayload image) {
        if (!displayQueue.offer(new DisplayFrame(envelope.sourceId(), image))) {
          metrics.increment("subscriber.display.queueFull");
          log.debug("Display queue full; frame at {} not shown", envelope.frameTime());
        }
      }
      if (envelope.topic() == FrameTopic.LOG) {
        echo.echo(record);
      }
    } finally {
      if (previousSource == null) {
        MDC.remove(MDC_SOURCE);
      } else {
        MDC.put(MDC_SOURCE, previousSource);
      }
    }
  }

  private void persist(Envelope envelope, MappingValue record) {
    if (imageSink != null && envelope.topic().carriesImage()) {
      imageSink.write(envelope);
    }
    if (annotationSink != null) {
      try {
        annotationSink.append(envelope.frameTime(), record);
      } catch (PersistenceException ex) {
        log.warn("Annotation {} failed: {}", ex.kind(), ex.getMessage());
      }
    }
  }

  private boolean isPersistable(Envelope envelope) {
    return annotationSink != null || (imageSink != null && envelope.topic().carriesImage());
  }

  private boolean persistenceEnabled() {
    return imageSink != null || annotationSink != null;
  }

  private void drop(StatsTracker stats) {
    stats.onDropped();
    metrics.increment("subscriber.dropped");
  }

  private void report(StatsSnapshot snapshot) {
    log.info(
        "Stats: received={} dropped={} elapsed={}s inFps={} avgDelay={}s",
        snapshot.received(),
        snapshot.dropped(),
        String.format("%.1f", snapshot.elapsedSeconds()),
        String.format("%.2f", snapshot.inFps()),
        String.format("%.3f", snapshot.averageDelaySeconds()));
    metrics.observe("subscriber.stats.inFpsMilli", Math.round(snapshot.inFps() * 1_000d));
    metrics.observe("subscriber.stats.delayMillis", Math.round(snapshot.averageDelaySeconds() * 1_000d));
  }

  /**
   * Loop tuning.
   *
   * @param inhibitSeconds minimum spacing between persisted frames; {@code 0} persists every frame
   * @param statsIntervalSeconds stats reporting interval; {@code 0} disables reporting
   */
  public record Settings(double inhibitSeconds, double statsIntervalSeconds) {
    public Settings {
      Numbers.requireSecondsAtLeast("inhibit", inhibitSeconds, 0d);
      Numbers.requireSecondsAtLeast("statsInterval", statsIntervalSeconds, 0d);
    }

    /**
     * Defaults used by {@code view}: no inhibition and a five second stats interval.
     *
     * @return default settings
     */
    public static Settings defaults() {
      return new Settings(0d, 5d);
    }
  }
}
