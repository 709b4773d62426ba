package ca.gc.cra.frametap.logging;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import java.util.Locale;
import java.util.Set;
import org.slf4j.ILoggerFactory;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Adjusts FrameTap log levels from CLI flags and configuration keys.
 * <p><strong>Why:</strong> Per-frame drop reasons log at DEBUG; operators raise verbosity with {@code --verbose}
 * or {@code logLevel=...} instead of editing {@code logback.xml}.</p>
 * <p><strong>Thread-safety:</strong> Intended for single-threaded CLI startup.</p>
 *
 * @implNote Tailored for Logback; other SLF4J bindings fall back to a warning and retain defaults.
 * @since 0.1.0
 * @see Logs
 */
public final class LoggingConfigurator {
  private static final org.slf4j.Logger log = LoggerFactory.getLogger(LoggingConfigurator.class);
  private static final String APPLICATION_LOGGER = "ca.gc.cra.frametap";
  private static final Set<String> LEVELS = Set.of("TRACE", "DEBUG", "INFO", "WARN", "ERROR");

  private LoggingConfigurator() {
    // Utility
  }

  /**
   * Elevates the root logger level to DEBUG within the running JVM.
   */
  public static void enableVerboseLogging() {
    withContext(context -> context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME).setLevel(Level.DEBUG));
  }

  /**
   * Applies a level to the application logger hierarchy.
   *
   * @param level one of TRACE, DEBUG, INFO, WARN, ERROR (case-insensitive); blank leaves levels unchanged
   * @throws IllegalArgumentException if the level name is not recognized
   */
  public static void applyApplicationLevel(String level) {
    if (level == null || level.isBlank()) {
      return;
    }
    String normalized = level.trim().toUpperCase(Locale.ROOT);
    if (!LEVELS.contains(normalized)) {
      throw new IllegalArgumentException("logLevel must be one of " + LEVELS + " (was " + level + ")");
    }
    withContext(context -> context.getLogger(APPLICATION_LOGGER).setLevel(Level.toLevel(normalized)));
  }

  private static void withContext(java.util.function.Consumer<LoggerContext> action) {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      action.accept(context);
      return;
    }
    log.warn("Log level change requested but backend {} does not support dynamic level updates",
        factory.getClass().getName());
  }

  static Level currentApplicationLevel() {
    ILoggerFactory factory = LoggerFactory.getILoggerFactory();
    if (factory instanceof LoggerContext context) {
      Logger logger = context.getLogger(APPLICATION_LOGGER);
      return logger.getEffectiveLevel();
    }
    return null;
  }
}
