package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.logging.LoggingConfigurator;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * FrameTap CLI dispatcher that routes to subcommands.
 *
 * <p>Flags placed before the command apply to the dispatcher; everything after the command is
 * handed to it untouched, so {@code frametap record --dry-run logDir=x} reaches {@link RecordCli}
 * with its flag.</p>
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: frametap <view|record|publish> [options]";
  private static final String HELP_TEXT = """
      FrameTap command dispatcher

      Usage:
        frametap <command> [options]

      Commands:
        view      Subscribe and render frames (view --help for details)
        record    Subscribe and persist images and annotations
        publish   Publish a test pattern or a directory of images

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to the command
      """;

  private Main() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Dispatches a subcommand and returns its exit code without terminating the JVM.
   *
   * @param args dispatcher arguments; the first non-flag token is the command
   * @return exit code reported by the command
   */
  static ExitCode run(String[] args) {
    List<String> leading = new ArrayList<>();
    String command = null;
    List<String> delegate = new ArrayList<>();
    if (args != null) {
      for (String arg : args) {
        if (arg == null) {
          continue;
        }
        if (command != null) {
          delegate.add(arg);
        } else if (arg.startsWith("-")) {
          leading.add(arg);
        } else {
          command = arg.trim().toLowerCase(Locale.ROOT);
        }
      }
    }

    CliInput input = CliInput.parse(leading.toArray(String[]::new));
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher");
    }
    if (command == null || command.equals("help")) {
      if (input.help() || "help".equals(command)) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String[] delegateArgs = delegate.toArray(String[]::new);
    return switch (command) {
      case ViewCli.MODE -> ViewCli.run(delegateArgs);
      case RecordCli.MODE -> RecordCli.run(delegateArgs);
      case PublishCli.MODE -> PublishCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }
}
