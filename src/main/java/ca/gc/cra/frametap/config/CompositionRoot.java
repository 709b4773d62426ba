package ca.gc.cra.frametap.config;

import ca.gc.cra.frametap.adapter.kafka.KafkaFramePublisher;
import ca.gc.cra.frametap.adapter.kafka.KafkaFrameSource;
import ca.gc.cra.frametap.application.flow.DisplayFrame;
import ca.gc.cra.frametap.application.flow.HandoffQueue;
import ca.gc.cra.frametap.application.pipeline.CancellationToken;
import ca.gc.cra.frametap.application.pipeline.DisplayLoop;
import ca.gc.cra.frametap.application.pipeline.PublishLoop;
import ca.gc.cra.frametap.application.pipeline.SubscriberLoop;
import ca.gc.cra.frametap.application.pipeline.TopicRouter;
import ca.gc.cra.frametap.application.port.AnnotationSinkPort;
import ca.gc.cra.frametap.application.port.ClockPort;
import ca.gc.cra.frametap.application.port.FrameCodec;
import ca.gc.cra.frametap.application.port.FrameProducer;
import ca.gc.cra.frametap.application.port.FramePublisher;
import ca.gc.cra.frametap.application.port.FrameSource;
import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.application.port.ImageSinkPort;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.application.port.RecordEchoPort;
import ca.gc.cra.frametap.infrastructure.codec.JsonWireCodec;
import ca.gc.cra.frametap.infrastructure.display.LoggingDisplayAdapter;
import ca.gc.cra.frametap.infrastructure.image.DirectoryFrameProducer;
import ca.gc.cra.frametap.infrastructure.image.ImageIoCodec;
import ca.gc.cra.frametap.infrastructure.image.TestPatternProducer;
import ca.gc.cra.frametap.infrastructure.persistence.image.ImageFileWriter;
import ca.gc.cra.frametap.infrastructure.persistence.log.AnnotationFormat;
import ca.gc.cra.frametap.infrastructure.persistence.log.CsvFormat;
import ca.gc.cra.frametap.infrastructure.persistence.log.JsonLinesFormat;
import ca.gc.cra.frametap.infrastructure.persistence.log.RotatingAnnotationWriter;
import ca.gc.cra.frametap.infrastructure.transport.zmq.ZmqFramePublisher;
import ca.gc.cra.frametap.infrastructure.transport.zmq.ZmqFrameSource;
import java.io.IOException;
import java.time.Duration;
import java.util.Objects;

/**
 * <strong>What:</strong> Central composition root that turns validated configuration into runnable loops.
 * <p><strong>Why:</strong> Keeps adapter selection (ZeroMQ vs Kafka, CSV vs JSON lines, test pattern
 * vs directory) out of the CLI and out of the loops themselves.</p>
 * <p><strong>Role:</strong> The only class that names concrete adapters.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared metrics and clock; factory
 * methods build fresh graphs and are intended for startup.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final long DISPLAY_SUMMARY_MILLIS = 5_000L;

  private final MetricsPort metrics;
  private final ClockPort clock;
  private final ImageCodec imageCodec = new ImageIoCodec();
  private final FrameCodec frameCodec = new JsonWireCodec();

  /**
   * Creates a composition root on the system clock.
   *
   * @param metrics metrics sink shared by every constructed component
   */
  public CompositionRoot(MetricsPort metrics) {
    this(metrics, ClockPort.SYSTEM);
  }

  /**
   * Creates a composition root with an explicit clock.
   *
   * @param metrics metrics sink shared by every constructed component
   * @param clock wall clock
   */
  public CompositionRoot(MetricsPort metrics, ClockPort clock) {
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Builds the subscriber loop with the sinks the configuration enables.
   *
   * @param config subscriber configuration
   * @param displayQueue render handoff, or {@code null} when display is off
   * @param echo console echo; ignored in quiet mode
   * @return subscriber loop ready to run
   */
  public SubscriberLoop subscriberLoop(
      SubscriberConfig config, HandoffQueue<DisplayFrame> displayQueue, RecordEchoPort echo) {
    Objects.requireNonNull(config, "config");
    return new SubscriberLoop(
        frameSource(config),
        frameCodec,
        new TopicRouter(imageCodec, metrics),
        imageSink(config),
        annotationSink(config),
        config.display() ? displayQueue : null,
        config.quiet() ? RecordEchoPort.SILENT : Objects.requireNonNull(echo, "echo"),
        clock,
        metrics,
        new SubscriberLoop.Settings(config.inhibitSeconds(), config.statsIntervalSeconds()));
  }

  /**
   * Builds the render loop over a headless display.
   *
   * @param config subscriber configuration
   * @param displayQueue handoff shared with the subscriber loop
   * @param token stop signal
   * @return display loop to run on the render thread
   */
  public DisplayLoop displayLoop(
      SubscriberConfig config, HandoffQueue<DisplayFrame> displayQueue, CancellationToken token) {
    return new DisplayLoop(
        displayQueue, new LoggingDisplayAdapter(clock, DISPLAY_SUMMARY_MILLIS), token, config.displayFps());
  }

  FrameSource frameSource(SubscriberConfig config) {
    return switch (config.ingress()) {
      case ZMQ -> new ZmqFrameSource(
          config.endpoints(), config.bindMode(), config.topics(), config.pollTimeoutMillis());
      case KAFKA -> new KafkaFrameSource(
          config.kafkaBootstrap().orElseThrow(),
          config.kafkaTopic(),
          Duration.ofMillis(config.pollTimeoutMillis()));
    };
  }

  ImageSinkPort imageSink(SubscriberConfig config) {
    return config.imageDir()
        .map(dir -> (ImageSinkPort) new ImageFileWriter(
            dir,
            imageCodec,
            config.imageEncoding(),
            config.jpegQuality(),
            config.fileIdKey(),
            config.timezone(),
            metrics))
        .orElse(null);
  }

  AnnotationSinkPort annotationSink(SubscriberConfig config) {
    if (config.logDir().isEmpty()) {
      return null;
    }
    AnnotationFormat format =
        config.csvFields().isEmpty() ? new JsonLinesFormat() : new CsvFormat(config.csvFields());
    return new RotatingAnnotationWriter(
        config.logDir().get(),
        format,
        config.logIntervalSeconds(),
        config.flatten(),
        config.timezone(),
        metrics);
  }

  /**
   * Builds the publish loop.
   *
   * @param config publisher configuration
   * @return publish loop ready to run
   * @throws IOException if {@code imagesFrom} cannot be listed or holds no images
   */
  public PublishLoop publishLoop(PublisherConfig config) throws IOException {
    Objects.requireNonNull(config, "config");
    FrameProducer producer = config.imagesFrom().isPresent()
        ? new DirectoryFrameProducer(config.imagesFrom().get())
        : new TestPatternProducer(config.width(), config.height());
    return new PublishLoop(
        producer,
        imageCodec,
        frameCodec,
        framePublisher(config),
        clock,
        metrics,
        new PublishLoop.Settings(
            config.sourceId(),
            config.fps(),
            config.jpeg(),
            config.jpegQuality(),
            config.logEvery(),
            config.count(),
            config.topicSuffix()));
  }

  FramePublisher framePublisher(PublisherConfig config) {
    return switch (config.egress()) {
      case ZMQ -> new ZmqFramePublisher(config.endpoints(), config.bindMode());
      case KAFKA -> new KafkaFramePublisher(config.kafkaBootstrap().orElseThrow(), config.kafkaTopic(), metrics);
    };
  }
}
