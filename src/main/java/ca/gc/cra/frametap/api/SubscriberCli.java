package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.application.flow.DisplayFrame;
import ca.gc.cra.frametap.application.flow.HandoffQueue;
import ca.gc.cra.frametap.application.pipeline.CancellationToken;
import ca.gc.cra.frametap.application.pipeline.SubscriberLoop;
import ca.gc.cra.frametap.application.port.TransportException;
import ca.gc.cra.frametap.config.CompositionRoot;
import ca.gc.cra.frametap.config.IngressMode;
import ca.gc.cra.frametap.config.SubscriberConfig;
import ca.gc.cra.frametap.infrastructure.exec.ExecutorFactories;
import ca.gc.cra.frametap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.frametap.logging.LoggingConfigurator;
import ca.gc.cra.frametap.validation.Paths;
import java.nio.file.Path;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.RejectedExecutionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared flow behind the {@code view} and {@code record} commands.
 * <p><strong>Why:</strong> Both commands run the same subscriber loop and differ only in defaults
 * ({@code display}) and in the requirement that {@code record} names an output directory.</p>
 * <p><strong>Role:</strong> Parses arguments, resolves configuration, validates output
 * directories, prints the dry-run plan, then owns the network thread and the render executor.</p>
 *
 * @since 0.1.0
 */
final class SubscriberCli {
  private static final Logger log = LoggerFactory.getLogger(SubscriberCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(5);
  private static final Duration RENDER_GRACE = Duration.ofSeconds(2);

  private SubscriberCli() {}

  static ExitCode run(String mode, String[] args, String usage, String helpText) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(helpText.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for {} CLI", mode);
    }
    boolean dryRun = input.hasFlag("--dry-run");
    boolean allowOverwrite = input.hasFlag("--allow-overwrite");

    Map<String, String> cliKv;
    try {
      cliKv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    Map<String, String> effective;
    try {
      effective = ConfigCliUtils.effectiveConfig(mode, cliKv, usage);
    } catch (CliAbort abort) {
      return abort.exitCode();
    }

    SubscriberConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      LoggingConfigurator.applyApplicationLevel(configInputs.remove("logLevel"));
      config = SubscriberConfig.fromMap(configInputs);
      validateOutputs(config, allowOverwrite, !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(usage);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(mode, config, allowOverwrite);
      return ExitCode.SUCCESS;
    }
    return execute(mode, config);
  }

  private static ExitCode execute(String mode, SubscriberConfig config) {
    CancellationToken token = new CancellationToken();
    OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter();
    ShutdownHook hook = ShutdownHook.install(token, SHUTDOWN_GRACE);
    ExecutorService render = null;
    try {
      CompositionRoot root = new CompositionRoot(metrics);
      HandoffQueue<DisplayFrame> queue =
          config.display() ? new HandoffQueue<>(config.queueCapacity()) : null;
      SubscriberLoop loop = root.subscriberLoop(config, queue, new ConsoleRecordEcho());
      if (queue != null) {
        render = ExecutorFactories.newRenderExecutor("frametap-display", null);
        render.execute(root.displayLoop(config, queue, token));
      }

      log.info("Starting {} via {} ({})", mode, config.ingress(), describeSource(config));
      loop.run(token);
      if (Thread.currentThread().isInterrupted()) {
        log.warn("{} interrupted", mode);
        return ExitCode.INTERRUPTED;
      }
      log.info("{} stopped", mode);
      return ExitCode.SUCCESS;
    } catch (TransportException ex) {
      log.error("{} transport failure: {}", mode, ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RejectedExecutionException ex) {
      log.error("Unable to start render thread", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in {}", mode, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      token.cancel();
      if (render != null) {
        ExecutorFactories.shutdownGracefully(render, RENDER_GRACE);
      }
      metrics.close();
      hook.close();
    }
  }

  private static void validateOutputs(SubscriberConfig config, boolean allowOverwrite, boolean create) {
    config.imageDir().ifPresent(dir -> Paths.validateWritableDir("imageDir", dir, create, allowOverwrite));
    config.logDir().ifPresent(dir -> Paths.validateWritableDir("logDir", dir, create, allowOverwrite));
  }

  private static String describeSource(SubscriberConfig config) {
    if (config.ingress() == IngressMode.KAFKA) {
      return config.kafkaBootstrap().orElse("<none>") + " topic " + config.kafkaTopic();
    }
    return (config.bindMode() ? "bind " : "connect ") + String.join(",", config.endpoints());
  }

  private static void printDryRunPlan(String mode, SubscriberConfig config, boolean allowOverwrite) {
    CliPrinter.printLines(
        capitalize(mode) + " dry-run: no frames will be received.",
        " Ingress          : " + config.ingress(),
        " Source           : " + describeSource(config),
        " Topics           : " + (config.topics().isEmpty() ? "<all>" : String.join(",", config.topics())),
        " Poll timeout (ms): " + config.pollTimeoutMillis(),
        " Image dir        : " + config.imageDir().map(Path::toString).orElse("<none>"),
        " Image encoding   : " + config.imageEncoding() + " (quality " + config.jpegQuality() + ")",
        " Log dir          : " + config.logDir().map(Path::toString).orElse("<none>"),
        " Log format       : " + (config.csvFields().isEmpty() ? "jsonl" : "csv " + config.csvFields()),
        " Log interval (s) : " + config.logIntervalSeconds(),
        " Flatten          : " + config.flatten(),
        " File id key      : " + config.fileIdKey(),
        " Inhibit (s)      : " + config.inhibitSeconds(),
        " Timezone         : " + config.timezone(),
        " Display          : " + config.display() + " (queue " + config.queueCapacity()
            + ", " + config.displayFps() + " fps)",
        " Stats interval(s): " + config.statsIntervalSeconds(),
        " Quiet            : " + config.quiet(),
        " Allow overwrite  : " + allowOverwrite,
        " Re-run without --dry-run to start receiving.");
  }

  private static String capitalize(String mode) {
    return Character.toUpperCase(mode.charAt(0)) + mode.substring(1);
  }
}
