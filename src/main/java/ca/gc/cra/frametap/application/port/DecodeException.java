package ca.gc.cra.frametap.application.port;

import java.util.Objects;

/**
 * Checked exception raised when a wire message cannot be turned into an envelope.
 *
 * <p>Always recoverable: the subscriber drops the message, counts it under its {@link Stage}, and continues.</p>
 *
 * @since 0.1.0
 */
public final class DecodeException extends Exception {
  /** Decoding step that rejected the message. */
  public enum Stage {
    /** Too few parts, or a part count that does not match the topic. */
    SHORT_MESSAGE("shortMessage"),
    /** Topic is not one of the known frame topics. */
    UNKNOWN_TOPIC("unknownTopic"),
    /** A part could not be deserialized or is inconsistent with its metadata. */
    BAD_ENCODING("badEncoding");

    private final String metricSuffix;

    Stage(String metricSuffix) {
      this.metricSuffix = metricSuffix;
    }

    /**
     * Returns the camel-case suffix used in metric names.
     *
     * @return metric suffix such as {@code shortMessage}
     */
    public String metricSuffix() {
      return metricSuffix;
    }
  }

  private final Stage stage;

  /**
   * Creates an exception for the given stage.
   *
   * @param stage failing stage
   * @param message human-readable detail
   */
  public DecodeException(Stage stage, String message) {
    super(message);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  /**
   * Creates an exception for the given stage with an underlying cause.
   *
   * @param stage failing stage
   * @param message human-readable detail
   * @param cause parser or codec failure
   */
  public DecodeException(Stage stage, String message, Throwable cause) {
    super(message, cause);
    this.stage = Objects.requireNonNull(stage, "stage");
  }

  public Stage stage() {
    return stage;
  }
}
