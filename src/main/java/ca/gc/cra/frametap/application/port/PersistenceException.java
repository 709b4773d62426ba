package ca.gc.cra.frametap.application.port;

import java.util.Objects;

/**
 * Checked exception raised when an image or log file cannot be written or published.
 *
 * <p>Recoverable: callers clean up the temporary file, count the failure, and move on to the next frame.</p>
 *
 * @since 0.1.0
 */
public final class PersistenceException extends Exception {
  /** Failing step. */
  public enum Kind {
    /** Encoding or writing the temporary file failed. */
    WRITE_FAILED("writeFailed"),
    /** Renaming the temporary file to its final name failed. */
    RENAME_FAILED("renameFailed");

    private final String metricSuffix;

    Kind(String metricSuffix) {
      this.metricSuffix = metricSuffix;
    }

    public String metricSuffix() {
      return metricSuffix;
    }
  }

  private final Kind kind;

  /**
   * Creates an exception of the given kind.
   *
   * @param kind failing step
   * @param message human-readable detail
   * @param cause underlying I/O failure
   */
  public PersistenceException(Kind kind, String message, Throwable cause) {
    super(message, cause);
    this.kind = Objects.requireNonNull(kind, "kind");
  }

  public Kind kind() {
    return kind;
  }
}
