package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.config.ConfigMerger;
import ca.gc.cra.frametap.config.DefaultsForMode;
import ca.gc.cra.frametap.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Resolves the effective configuration of a command from CLI arguments, an optional YAML file and
 * the command defaults.
 */
final class ConfigCliUtils {
  private static final Logger log = LoggerFactory.getLogger(ConfigCliUtils.class);

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} path from parsed CLI arguments.
   *
   * @param args mutable CLI map
   * @return trimmed path, or {@code null} when absent
   */
  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    String value = args.remove("config");
    return value == null || value.isBlank() ? null : value.trim();
  }

  /**
   * Builds the merged map for {@code mode}. Failures are logged and usage printed here.
   *
   * @param mode command name
   * @param cliKv mutable CLI map; the {@code config} key is consumed
   * @param usage summary usage printed on argument errors
   * @return effective configuration
   * @throws CliAbort with {@link ExitCode#INVALID_ARGS}, {@link ExitCode#CONFIG_ERROR} or {@link ExitCode#IO_ERROR}
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> cliKv, String usage)
      throws CliAbort {
    Optional<Map<String, String>> yaml = loadYaml(extractConfigPath(cliKv), mode, usage);
    try {
      return ConfigMerger.buildEffectiveConfig(
          mode, yaml, cliKv, DefaultsForMode.asFlatMap(mode), log::warn);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path yamlPath;
    try {
      yamlPath = Path.of(configPath);
    } catch (InvalidPathException ex) {
      log.error("Configuration path is invalid: {}", ex.getMessage());
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }
    if (!Files.exists(yamlPath)) {
      log.error("Configuration file does not exist: {}", yamlPath);
      CliPrinter.println(usage);
      throw new CliAbort(ExitCode.INVALID_ARGS);
    }

    try {
      return YamlConfigLoader.load(yamlPath, mode);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid YAML configuration {}: {}", yamlPath, ex.getMessage());
      throw new CliAbort(ExitCode.CONFIG_ERROR);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", yamlPath, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }
}
