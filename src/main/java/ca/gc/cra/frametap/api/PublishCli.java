package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.application.pipeline.CancellationToken;
import ca.gc.cra.frametap.application.pipeline.PublishLoop;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.config.CompositionRoot;
import ca.gc.cra.frametap.config.IngressMode;
import ca.gc.cra.frametap.config.PublisherConfig;
import ca.gc.cra.frametap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.frametap.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Publishes a test pattern or a directory of images using the same wire protocol the subscribers
 * consume.
 *
 * @since 0.1.0
 */
public final class PublishCli {
  private static final Logger log = LoggerFactory.getLogger(PublishCli.class);
  static final String MODE = "publish";
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(3);
  private static final String SUMMARY_USAGE =
      "usage: publish [bind=tcp://*:PORT|connect=URL] [egress=ZMQ|KAFKA kafkaBootstrap=HOST:PORT] "
          + "[sourceId=ID] [imagesFrom=DIR] [width=N height=N] [fps=1-240] [jpeg=true|false] "
          + "[logEvery=N] [count=N] [topicSuffix=true] [config=FILE] [--dry-run]";
  private static final String HELP_TEXT = """
      FrameTap publisher

      Usage:
        publish [options]

      Transport:
        bind=URL[,URL]            PUB endpoints to bind (default tcp://*:5555)
        connect=URL[,URL]         PUB endpoints to connect to instead of binding
        egress=ZMQ|KAFKA          Kafka bridge requires kafkaBootstrap
        kafkaBootstrap=HOST:PORT  Kafka bootstrap servers
        kafkaTopic=NAME           Kafka topic (default frametap.frames)

      Frames:
        sourceId=ID               Identifier stamped on every frame (default frametap)
        imagesFrom=DIR            Cycle through .jpg/.png files (default test pattern)
        width=N height=N          Test pattern size (default 320x240)
        fps=1-240                 Publish rate (default 10)
        jpeg=true|false           Publish JpegFrame instead of VideoFrame (default true)
        jpegQuality=1-100         JPEG quality (default 95)
        logEvery=N                Emit a LogFrame every N frames, 0 never (default 0)
        count=N                   Stop after N frames, 0 unbounded (default 0)
        topicSuffix=true|false    Append /sourceId to topics

      Common:
        config=FILE               YAML file with common: and publish: sections
        logLevel=LEVEL  metricsExporter=otlp|none  otelEndpoint=URL
        --dry-run                 Validate and print the plan
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private PublishCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for publish CLI");
    }

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(MODE, cliKv, SUMMARY_USAGE);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    PublisherConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      LoggingConfigurator.applyApplicationLevel(configInputs.remove("logLevel"));
      config = PublisherConfig.fromMap(configInputs);
      config.imagesFrom().ifPresent(PublishCli::requireImageDirectory);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid publish configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (input.hasFlag("--dry-run")) {
      printDryRunPlan(config);
      return ExitCode.SUCCESS;
    }
    return execute(config);
  }

  private static ExitCode execute(PublisherConfig config) {
    CancellationToken token = new CancellationToken();
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    ShutdownHook hook = ShutdownHook.install(token, SHUTDOWN_GRACE);
    try {
      PublishLoop loop = new CompositionRoot(metrics).publishLoop(config);
      log.info("Publishing as {} via {} ({})", config.sourceId(), config.egress(), describeTarget(config));
      long sent = loop.run(token);
      log.info("Publisher stopped after {} frames", sent);
      return Thread.currentThread().isInterrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read images from {}", config.imagesFrom().orElse(null), ex);
      return ExitCode.IO_ERROR;
    } catch (TransportException ex) {
      log.error("Publish transport failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in publish", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      token.cancel();
      metrics.close();
      hook.close();
    }
  }

  private static void requireImageDirectory(Path dir) {
    if (!Files.isDirectory(dir) || !Files.isReadable(dir)) {
      throw new IllegalArgumentException("imagesFrom must be a readable directory: " + dir);
    }
  }

  private static String describeTarget(PublisherConfig config) {
    if (config.egress() == IngressMode.KAFKA) {
      return config.kafkaBootstrap().orElse("<none>") + " topic " + config.kafkaTopic();
    }
    return (config.bindMode() ? "bind " : "connect ") + String.join(",", config.endpoints());
  }

  private static void printDryRunPlan(PublisherConfig config) {
    CliPrinter.printLines(
        "Publish dry-run: no frames will be sent.",
        " Egress           : " + config.egress(),
        " Target           : " + describeTarget(config),
        " Source id        : " + config.sourceId(),
        " Images           : " + config.imagesFrom().map(Path::toString)
            .orElse("test pattern " + config.width() + "x" + config.height()),
        " Topic            : " + (config.jpeg() ? "JpegFrame" : "VideoFrame")
            + (config.topicSuffix() ? "/" + config.sourceId() : ""),
        " Rate (fps)       : " + config.fps(),
        " Log every        : " + (config.logEvery() == 0 ? "never" : config.logEvery() + " frames"),
        " Count            : " + (config.count() == 0 ? "unbounded" : Long.toString(config.count())),
        " Re-run without --dry-run to start publishing.");
  }
}
