package ca.gc.cra.frametap.config;

import static ca.gc.cra.frametap.config.ConfigValues.optionalText;
import static ca.gc.cra.frametap.config.ConfigValues.parseBoolean;
import static ca.gc.cra.frametap.config.ConfigValues.parseBoundedInt;
import static ca.gc.cra.frametap.config.ConfigValues.parseOptionalPath;
import static ca.gc.cra.frametap.config.ConfigValues.parseSeconds;

import ca.gc.cra.frametap.domain.frame.ImageFormat;
import ca.gc.cra.frametap.validation.Endpoints;
import ca.gc.cra.frametap.validation.Numbers;
import ca.gc.cra.frametap.validation.Strings;
import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable settings for the {@code view} and {@code record} subscriber commands.
 * <p><strong>Why:</strong> Centralizes validation of transport, persistence and display options before
 * any socket or file is opened.</p>
 * <p><strong>Role:</strong> Produced from the merged CLI/YAML/default map and consumed by
 * {@link CompositionRoot}.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe to share.</p>
 *
 * @param ingress transport used to receive frames
 * @param connect ZeroMQ endpoints to connect to; empty when binding
 * @param bind ZeroMQ endpoints to bind; empty when connecting
 * @param topics subscription prefixes; empty subscribes to every frame topic
 * @param kafkaBootstrap Kafka bootstrap servers when {@code ingress=KAFKA}
 * @param kafkaTopic Kafka topic carrying framed messages
 * @param pollTimeoutMillis bounded receive timeout
 * @param imageDir image output directory, if images are recorded
 * @param logDir annotation output directory, if annotations are recorded
 * @param fileIdKey dot path into the annotation naming image files
 * @param timezone zone used to render file-name timestamps
 * @param inhibitSeconds minimum spacing between persisted frames
 * @param logIntervalSeconds annotation window length
 * @param flatten whether annotations are flattened before writing
 * @param csvFields CSV columns; empty selects JSON lines
 * @param imageEncoding on-disk image format
 * @param jpegQuality JPEG quality, 1..100
 * @param statsIntervalSeconds stats report interval; {@code 0} disables reporting
 * @param display whether the render thread runs
 * @param queueCapacity display handoff capacity
 * @param displayFps render pacing
 * @param quiet suppresses the stdout echo of log frames
 * @since 0.1.0
 */
public record SubscriberConfig(
    IngressMode ingress,
    List<String> connect,
    List<String> bind,
    List<String> topics,
    Optional<String> kafkaBootstrap,
    String kafkaTopic,
    int pollTimeoutMillis,
    Optional<Path> imageDir,
    Optional<Path> logDir,
    String fileIdKey,
    ZoneId timezone,
    double inhibitSeconds,
    double logIntervalSeconds,
    boolean flatten,
    List<String> csvFields,
    ImageFormat imageEncoding,
    int jpegQuality,
    double statsIntervalSeconds,
    boolean display,
    int queueCapacity,
    int displayFps,
    boolean quiet) {

  static final String DEFAULT_CONNECT = "tcp://localhost:5555";
  static final String DEFAULT_KAFKA_TOPIC = "frametap.frames";
  private static final int MAX_POLL_TIMEOUT_MILLIS = 10_000;
  private static final int MAX_QUEUE_CAPACITY = 1_024;
  private static final int MAX_DISPLAY_FPS = 240;

  public SubscriberConfig {
    Objects.requireNonNull(ingress, "ingress");
    Objects.requireNonNull(kafkaBootstrap, "kafkaBootstrap");
    Objects.requireNonNull(imageDir, "imageDir");
    Objects.requireNonNull(logDir, "logDir");
    Objects.requireNonNull(timezone, "timezone");
    Objects.requireNonNull(imageEncoding, "imageEncoding");
    connect = List.copyOf(Objects.requireNonNull(connect, "connect"));
    bind = List.copyOf(Objects.requireNonNull(bind, "bind"));
    topics = List.copyOf(Objects.requireNonNull(topics, "topics"));
    csvFields = List.copyOf(Objects.requireNonNull(csvFields, "csvFields"));

    if (ingress == IngressMode.ZMQ) {
      if (connect.isEmpty() == bind.isEmpty()) {
        throw new IllegalArgumentException("exactly one of connect or bind must be set for ZMQ ingress");
      }
      connect = validateEndpoints(connect, false);
      bind = validateEndpoints(bind, true);
    } else {
      String servers = kafkaBootstrap
          .orElseThrow(() -> new IllegalArgumentException("kafkaBootstrap is required when ingress=KAFKA"));
      Strings.splitList("kafkaBootstrap", servers).forEach(Endpoints::validateHostPort);
    }
    kafkaTopic = Strings.sanitizeTopic("kafkaTopic", kafkaTopic);
    for (String topic : topics) {
      Strings.requirePrintableAscii("topics", topic, 256);
    }
    for (String field : csvFields) {
      Strings.requireNonBlank("csvFields", field);
    }
    Numbers.requireRange("pollTimeoutMillis", pollTimeoutMillis, 1, MAX_POLL_TIMEOUT_MILLIS);
    fileIdKey = Strings.requireNonBlank("fileIdKey", fileIdKey);
    Numbers.requireSecondsAtLeast("inhibit", inhibitSeconds, 0);
    Numbers.requireSecondsAtLeast("logInterval", logIntervalSeconds, 1);
    Numbers.requireSecondsAtLeast("statsInterval", statsIntervalSeconds, 0);
    Numbers.requireRange("jpegQuality", jpegQuality, 1, 100);
    Numbers.requireRange("queueCapacity", queueCapacity, 1, MAX_QUEUE_CAPACITY);
    Numbers.requireRange("displayFps", displayFps, 1, MAX_DISPLAY_FPS);
  }

  /**
   * Returns defaults matching {@code view}: connect to the local publisher and show frames.
   *
   * @return default configuration
   */
  public static SubscriberConfig defaults() {
    return new SubscriberConfig(
        IngressMode.ZMQ,
        List.of(DEFAULT_CONNECT),
        List.of(),
        List.of(),
        Optional.empty(),
        DEFAULT_KAFKA_TOPIC,
        100,
        Optional.empty(),
        Optional.empty(),
        "source_id",
        ZoneId.systemDefault(),
        0,
        60,
        false,
        List.of(),
        ImageFormat.JPEG,
        95,
        5,
        true,
        8,
        30,
        false);
  }

  /**
   * Builds a configuration from flat {@code key=value} pairs, falling back to {@link #defaults()}.
   *
   * @param kv merged configuration map
   * @return validated configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static SubscriberConfig fromMap(Map<String, String> kv) {
    Objects.requireNonNull(kv, "kv");
    SubscriberConfig defaults = defaults();
    List<List<String>> endpoints = ConfigValues.endpoints(kv, defaults.connect(), defaults.bind());

    return new SubscriberConfig(
        IngressMode.fromString(kv.get("ingress")),
        endpoints.get(0),
        endpoints.get(1),
        Strings.splitList("topics", kv.get("topics")),
        optionalText(kv.get("kafkaBootstrap")),
        optionalText(kv.get("kafkaTopic")).orElse(defaults.kafkaTopic()),
        parseBoundedInt(kv, "pollTimeoutMillis", defaults.pollTimeoutMillis(), 1, MAX_POLL_TIMEOUT_MILLIS),
        parseOptionalPath("imageDir", kv.get("imageDir")),
        parseOptionalPath("logDir", kv.get("logDir")),
        optionalText(kv.get("fileIdKey")).orElse(defaults.fileIdKey()),
        parseZone(kv.get("timezone"), defaults.timezone()),
        parseSeconds(kv, "inhibit", defaults.inhibitSeconds(), 0),
        parseSeconds(kv, "logInterval", defaults.logIntervalSeconds(), 1),
        parseBoolean(kv.get("flatten"), defaults.flatten()),
        Strings.splitList("csvFields", kv.get("csvFields")),
        optionalText(kv.get("imageEncoding")).map(ImageFormat::fromString).orElse(defaults.imageEncoding()),
        parseBoundedInt(kv, "jpegQuality", defaults.jpegQuality(), 1, 100),
        parseSeconds(kv, "statsInterval", defaults.statsIntervalSeconds(), 0),
        parseBoolean(kv.get("display"), defaults.display()),
        parseBoundedInt(kv, "queueCapacity", defaults.queueCapacity(), 1, MAX_QUEUE_CAPACITY),
        parseBoundedInt(kv, "displayFps", defaults.displayFps(), 1, MAX_DISPLAY_FPS),
        parseBoolean(kv.get("quiet"), defaults.quiet()));
  }

  /**
   * Indicates whether any output directory is configured.
   *
   * @return {@code true} when images or annotations are persisted
   */
  public boolean persistenceEnabled() {
    return imageDir.isPresent() || logDir.isPresent();
  }

  /**
   * Indicates whether the SUB socket binds rather than connects.
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

  private static List<String> validateEndpoints(List<String> endpoints, boolean bind) {
    List<String> validated = new ArrayList<>(endpoints.size());
    for (String endpoint : endpoints) {
      validated.add(Endpoints.validateZmqEndpoint(endpoint, bind));
    }
    return List.copyOf(validated);
  }

  private static ZoneId parseZone(String value, ZoneId fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return ZoneId.of(value.trim());
    } catch (DateTimeException ex) {
      throw new IllegalArgumentException("timezone is not a valid zone id: " + value, ex);
    }
  }
}
