package ca.gc.cra.frametap.config;

import ca.gc.cra.frametap.validation.Numbers;
import ca.gc.cra.frametap.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** Shared parsing of flat {@code key=value} maps into typed config values. */
final class ConfigValues {
  private ConfigValues() {}

  static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    return (int) parseBoundedLong(kv, key, defaultValue, min, max);
  }

  static long parseBoundedLong(Map<String, String> kv, String key, long defaultValue, long min, long max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      Numbers.requireRange(key, defaultValue, min, max);
      return defaultValue;
    }
    try {
      long parsed = Long.parseLong(raw.trim());
      Numbers.requireRange(key, parsed, min, max);
      return parsed;
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be an integer between " + min + " and " + max, ex);
    }
  }

  static double parseSeconds(Map<String, String> kv, String key, double defaultValue, double min) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return Numbers.requireSecondsAtLeast(key, defaultValue, min);
    }
    try {
      return Numbers.requireSecondsAtLeast(key, Double.parseDouble(raw.trim()), min);
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(key + " must be a number of seconds >= " + min, ex);
    }
  }

  static boolean parseBoolean(String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim();
    if (normalized.equalsIgnoreCase("on") || normalized.equalsIgnoreCase("yes")) {
      return true;
    }
    return Boolean.parseBoolean(normalized);
  }

  static Path parsePath(String name, String value) {
    try {
      return Path.of(Strings.requireNonBlank(name, value)).toAbsolutePath().normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  static Optional<Path> parseOptionalPath(String name, String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(parsePath(name, value));
  }

  static Optional<String> optionalText(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    return Optional.of(value.trim());
  }

  /**
   * Resolves the endpoint lists for a socket that must either connect or bind, never both.
   * An explicit {@code bind} without {@code connect} suppresses the default connect list.
   */
  static List<List<String>> endpoints(Map<String, String> kv, List<String> defaultConnect, List<String> defaultBind) {
    boolean hasConnect = kv.containsKey("connect");
    boolean hasBind = kv.containsKey("bind");
    List<String> connect;
    List<String> bind;
    if (!hasConnect && !hasBind) {
      connect = defaultConnect;
      bind = defaultBind;
    } else {
      connect = hasConnect ? Strings.splitList("connect", kv.get("connect")) : List.of();
      bind = hasBind ? Strings.splitList("bind", kv.get("bind")) : List.of();
    }
    return List.of(connect, bind);
  }
}
