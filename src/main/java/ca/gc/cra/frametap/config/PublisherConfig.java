package ca.gc.cra.frametap.config;

import static ca.gc.cra.frametap.config.ConfigValues.optionalText;
import static ca.gc.cra.frametap.config.ConfigValues.parseBoolean;
import static ca.gc.cra.frametap.config.ConfigValues.parseBoundedInt;
import static ca.gc.cra.frametap.config.ConfigValues.parseBoundedLong;
import static ca.gc.cra.frametap.config.ConfigValues.parseOptionalPath;

import ca.gc.cra.frametap.validation.Endpoints;
import ca.gc.cra.frametap.validation.Numbers;
import ca.gc.cra.frametap.validation.Strings;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the {@code publish} command, which feeds test or directory images onto the wire.
 *
 * @param egress transport used to send frames
 * @param connect ZeroMQ endpoints the PUB socket connects to; empty when binding
 * @param bind ZeroMQ endpoints the PUB socket binds; empty when connecting
 * @param kafkaBootstrap Kafka bootstrap servers when {@code egress=KAFKA}
 * @param kafkaTopic Kafka topic receiving framed messages
 * @param sourceId identifier stamped on every frame
 * @param imagesFrom directory of images to cycle through; empty publishes a test pattern
 * @param width test pattern width
 * @param height test pattern height
 * @param fps publish rate
 * @param jpeg publish {@code JpegFrame} instead of {@code VideoFrame}
 * @param jpegQuality JPEG quality, 1..100
 * @param logEvery emit a {@code LogFrame} every N frames; {@code 0} never
 * @param count stop after N frames; {@code 0} unbounded
 * @param topicSuffix append {@code "/" + sourceId} to topics
 * @since 0.1.0
 */
public record PublisherConfig(
    IngressMode egress,
    List<String> connect,
    List<String> bind,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    String sourceId,
    Optional<Path> imagesFrom,
    int width,
    int height,
    int fps,
    boolean jpeg,
    int jpegQuality,
    int logEvery,
    long count,
    boolean topicSuffix) {

  static final String DEFAULT_BIND = "tcp://*:5555";
  private static final int MAX_DIMENSION = 4_096;

  public PublisherConfig {
    Objects.requireNonNull(egress, "egress");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(imagesFrom, "imagesFrom");
    connect = List.copyOf(Objects.requireNonNull(connect, "connect"));
    bind = List.copyOf(Objects.requireNonNull(bind, "bind"));
    if (egress == IngressMode.ZMQ) {
      if (connect.isEmpty() == bind.isEmpty()) {
        throw new IllegalArgumentException("exactly one of connect or bind must be set for ZMQ egress");
      }
      connect = connect.stream().map(e -> Endpoints.validateZmqEndpoint(e, false)).toList();
      bind = bind.stream().map(e -> Endpoints.validateZmqEndpoint(e, true)).toList();
    } else {
      String servers = kafkaBootstrap
          .orElseThrow(() -> new IllegalArgumentException("kafkaBootstrap is required when egress=KAFKA"));
      Strings.splitList("kafkaBootstrap", servers).forEach(Endpoints::validateHostPort);
    }
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic);
    sourceId = Strings.requirePrintableAscii("sourceId", sourceId, 128);
    if (sourceId.contains("/")) {
      throw new IllegalArgumentException("sourceId must not contain '/'");
    }
    Numbers.requireRange("width", width, 1, MAX_DIMENSION);
    Numbers.requireRange("height", height, 1, MAX_DIMENSION);
    Numbers.requireRange("fps", fps, 1, 240);
    Numbers.requireRange("jpegQuality", jpegQuality, 1, 100);
    Numbers.requireRange("logEvery", logEvery, 0, Integer.MAX_VALUE);
    Numbers.requireRange("count", count, 0, Long.MAX_VALUE);
  }

  /**
   * Returns defaults: bind the local PUB endpoint and stream a JPEG test pattern at 10 fps.
   *
   * @return default configuration
   */
  public static PublisherConfig defaults() {
    return new PublisherConfig(
        IngressMode.ZMQ,
        List.of(),
        List.of(DEFAULT_BIND),
        Optional.empty(),
        SubscriberConfig.DEFAULT_KAFKA_TOPIC,
        "frametap",
        Optional.empty(),
        320,
        240,
        10,
        true,
        95,
        0,
        0,
        false);
  }

  /**
   * Builds a configuration from flat {@code key=value} pairs, falling back to {@link #defaults()}.
   *
   * @param kv merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PublisherConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    PublisherConfig defaults = defaults();
    List<List<String>> endpoints = ConfigValues.endpoints(kv, defaults.connect(), defaults.bind());
    return new PublisherConfig(
        IngressMode.fromString(kv.get("egress")),
        endpoints.get(0),
        endpoints.get(1),
        optionalText(kv.get("kafkaBootstrap")),
        optionalText(kv.get("kafkaTopic")).orElse(defaults.kafkaTopic()),
        optionalText(kv.get("sourceId")).orElse(defaults.sourceId()),
        parseOptionalPath("imagesFrom", kv.get("imagesFrom")),
        parseBoundedInt(kv, "width", defaults.width(), 1, MAX_DIMENSION),
        parseBoundedInt(kv, "height", defaults.height(), 1, MAX_DIMENSION),
        parseBoundedInt(kv, "fps", defaults.fps(), 1, 240),
        parseBoolean(kv.get("jpeg"), defaults.jpeg()),
        parseBoundedInt(kv, "jpegQuality", defaults.jpegQuality(), 1, 100),
        parseBoundedInt(kv, "logEvery", defaults.logEvery(), 0, Integer.MAX_VALUE),
        parseBoundedLong(kv, "count", defaults.count(), 0, Long.MAX_VALUE),
        parseBoolean(kv.get("topicSuffix"), defaults.topicSuffix()));
  }

  /**
   * Indicates whether the PUB socket binds rather than connects.
   *
   * @return {@code true} when {@link #bind()} is populated
   */
  public boolean bindMode() {
    return !bind.isEmpty();
  }

  /**
   * Returns the active ZeroMQ endpoint list.
   *
   * @return bind endpoints in bind mode, otherwise connect endpoints
   */
  public List<String> endpoints() {
    return bindMode() ? bind : connect;
  }
}
