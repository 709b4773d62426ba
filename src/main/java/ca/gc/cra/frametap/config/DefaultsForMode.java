package ca.gc.cra.frametap.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default configuration maps for each CLI command.
 *
 * <p>Values are rendered from {@link SubscriberConfig#defaults()} and {@link PublisherConfig#defaults()}
 * so the records stay the single source of truth. Optional keys without a default (such as
 * {@code imageDir}) are absent rather than blank.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command merged over the common defaults.
   *
   * @param mode command name ({@code view}, {@code record}, {@code publish})
   * @return unmodifiable map of default key/value pairs
   * @throws IllegalArgumentException if the command is unknown
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "view" -> buildSubscriberDefaults(true);
      case "record" -> buildSubscriberDefaults(false);
      case "publish" -> buildPublisherDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("logLevel", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSubscriberDefaults(boolean display) {
    SubscriberConfig defaults = SubscriberConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("ingress", defaults.ingress().name());
    map.put("connect", String.join(",", defaults.connect()));
    map.put("topics", "");
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", defaults.kafkaTopic());
    map.put("pollTimeoutMillis", Integer.toString(defaults.pollTimeoutMillis()));
    map.put("fileIdKey", defaults.fileIdKey());
    map.put("timezone", "");
    map.put("inhibit", Double.toString(defaults.inhibitSeconds()));
    map.put("logInterval", Double.toString(defaults.logIntervalSeconds()));
    map.put("flatten", Boolean.toString(defaults.flatten()));
    map.put("csvFields", "");
    map.put("imageEncoding", defaults.imageEncoding().name());
    map.put("jpegQuality", Integer.toString(defaults.jpegQuality()));
    map.put("statsInterval", Double.toString(defaults.statsIntervalSeconds()));
    map.put("display", Boolean.toString(display));
    map.put("queueCapacity", Integer.toString(defaults.queueCapacity()));
    map.put("displayFps", Integer.toString(defaults.displayFps()));
    map.put("quiet", Boolean.toString(defaults.quiet()));
    return map;
  }

  private static Map<String, String> buildPublisherDefaults() {
    PublisherConfig defaults = PublisherConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("egress", defaults.egress().name());
    map.put("bind", String.join(",", defaults.bind()));
    map.put("kafkaBootstrap", "");
    map.put("kafkaTopic", defaults.kafkaTopic());
    map.put("sourceId", defaults.sourceId());
    map.put("width", Integer.toString(defaults.width()));
    map.put("height", Integer.toString(defaults.height()));
    map.put("fps", Integer.toString(defaults.fps()));
    map.put("jpeg", Boolean.toString(defaults.jpeg()));
    map.put("jpegQuality", Integer.toString(defaults.jpegQuality()));
    map.put("logEvery", Integer.toString(defaults.logEvery()));
    map.put("count", Long.toString(defaults.count()));
    map.put("topicSuffix", Boolean.toString(defaults.topicSuffix()));
    return map;
  }
}
