package ca.gc.cra.frametap.api;

/** Stops a command early with an exit code; the cause has already been logged. */
final class CliAbort extends Exception {
  private static final long serialVersionUID = 1L;

  private final ExitCode exitCode;

  CliAbort(ExitCode exitCode) {
    super(null, null, false, false);
    this.exitCode = exitCode;
  }

  ExitCode exitCode() {
    return exitCode;
  }
}
