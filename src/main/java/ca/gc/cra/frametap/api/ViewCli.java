package ca.gc.cra.frametap.api;

/**
 * Subscribes to frames and renders them on the display thread without persisting anything
 * unless an output directory is given.
 *
 * @since 0.1.0
 */
public final class ViewCli {
  static final String MODE = "view";
  private static final String SUMMARY_USAGE =
      "usage: view [connect=tcp://HOST:PORT,...|bind=tcp://*:PORT,...] [topics=PREFIX,...] "
          + "[ingress=ZMQ|KAFKA kafkaBootstrap=HOST:PORT kafkaTopic=T] [imageDir=PATH] [logDir=PATH] "
          + "[display=true|false] [quiet=true] [config=FILE] [--dry-run] [--allow-overwrite] [--verbose]";
  private static final String HELP_TEXT = """
      FrameTap viewer

      Usage:
        view [options]

      Transport:
        connect=URL[,URL]         ZeroMQ endpoints to connect to (default tcp://localhost:5555)
        bind=URL[,URL]            ZeroMQ endpoints to bind instead of connecting
        topics=PREFIX[,PREFIX]    Subscription prefixes (default VideoFrame,JpegFrame,LogFrame)
        ingress=ZMQ|KAFKA         Kafka bridge requires kafkaBootstrap
        kafkaBootstrap=HOST:PORT  Kafka bootstrap servers
        kafkaTopic=NAME           Kafka topic (default frametap.frames)
        pollTimeoutMillis=1-10000 Receive timeout (default 100)

      Display:
        display=true|false        Run the render thread (default true)
        queueCapacity=1-1024      Frames buffered for the renderer (default 8)
        displayFps=1-240          Render pacing (default 30)
        quiet=true|false          Suppress stdout echo of LogFrame records

      Optional persistence (see record --help):
        imageDir=PATH  logDir=PATH  inhibit=SECONDS  logInterval=SECONDS

      Common:
        config=FILE               YAML file with common: and view: sections
        statsInterval=SECONDS     Stats report interval, 0 disables (default 5)
        logLevel=LEVEL            Level for ca.gc.cra.frametap loggers
        metricsExporter=otlp|none Metrics exporter (default none)
        otelEndpoint=URL          OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V,...
        --dry-run                 Validate and print the plan
        --allow-overwrite         Permit non-empty output directories
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private ViewCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    return SubscriberCli.run(MODE, args, SUMMARY_USAGE, HELP_TEXT);
  }
}
