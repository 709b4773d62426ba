package ca.gc.cra.frametap.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML and CLI sources while enforcing precedence and
 * cross-key rules.
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * <p>A layer that sets only one of {@code connect}/{@code bind} replaces whichever of the two
   * an earlier layer supplied, so overriding the default direction never trips the exclusivity
   * check.</p>
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked when a CLI key overrides a YAML key
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when a cross-key rule fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    overlay(merged, yamlCopy);

    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      if (yamlCopy.containsKey(entry.getKey()) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + entry.getKey());
      }
    }
    overlay(merged, cliCopy);

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void overlay(Map<String, String> merged, Map<String, String> layer) {
    if (layer.containsKey("bind") && !layer.containsKey("connect")) {
      merged.remove("connect");
    }
    if (layer.containsKey("connect") && !layer.containsKey("bind")) {
      merged.remove("bind");
    }
    for (Map.Entry<String, String> entry : layer.entrySet()) {
      if (entry.getKey() != null && entry.getValue() != null) {
        merged.put(entry.getKey(), entry.getValue());
      }
    }
  }

  private static void validate(String mode, Map<String, String> effective) {
    String transportKey = "publish".equalsIgnoreCase(mode) ? "egress" : "ingress";
    IngressMode transport = IngressMode.fromString(effective.get(transportKey));
    if (transport == IngressMode.KAFKA) {
      if (trim(effective.get("kafkaBootstrap")).isEmpty()) {
        throw new IllegalArgumentException("kafkaBootstrap is required when " + transportKey + "=KAFKA");
      }
    } else if (!trim(effective.get("connect")).isEmpty() && !trim(effective.get("bind")).isEmpty()) {
      throw new IllegalArgumentException("connect and bind are mutually exclusive");
    }

    if ("record".equalsIgnoreCase(mode)
        && trim(effective.get("imageDir")).isEmpty()
        && trim(effective.get("logDir")).isEmpty()) {
      throw new IllegalArgumentException("record requires at least one of imageDir or logDir");
    }
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
