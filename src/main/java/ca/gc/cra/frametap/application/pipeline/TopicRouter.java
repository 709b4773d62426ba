package ca.gc.cra.frametap.application.pipeline;

import ca.gc.cra.frametap.application.port.DecodeException;
import ca.gc.cra.frametap.application.port.DecodeException.Stage;
import ca.gc.cra.frametap.application.port.ImageCodec;
import ca.gc.cra.frametap.application.port.MetricsPort;
import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.FrameTopic;
import ca.gc.cra.frametap.domain.frame.ImagePayload;
import ca.gc.cra.frametap.domain.frame.PixelEncoding;
import java.io.IOException;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Classifies wire topics and normalizes decoded envelopes into the payload shapes the
 * subscriber persists and displays.
 * <p><strong>Why:</strong> Publishers may suffix topics with {@code "/" + sourceId} so subscribers can filter
 * per source; JPEG frames are decoded once here so downstream stages only ever see raw pixels.</p>
 * <p><strong>Thread-safety:</strong> Safe to share when the supplied {@link ImageCodec} is.</p>
 *
 * @since 0.1.0
 */
public final class TopicRouter {
  private static final Logger log = LoggerFactory.getLogger(TopicRouter.class);

  private final ImageCodec imageCodec;
  private final MetricsPort metrics;

  /**
   * Creates a router.
   *
   * @param imageCodec codec used to turn JPEG buffers into raw pixels
   * @param metrics metrics sink for unknown-topic drops
   */
  public TopicRouter(ImageCodec imageCodec, MetricsPort metrics) {
    this.imageCodec = Objects.requireNonNull(imageCodec, "imageCodec");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
  }

  /**
   * Removes a trailing {@code "/" + sourceId} from a raw topic.
   *
   * @param rawTopic topic as received
   * @param sourceId source identifier from the second message part
   * @return logical topic name
   */
  public static String logicalTopic(String rawTopic, String sourceId) {
    if (rawTopic == null) {
      return "";
    }
    if (sourceId != null) {
      String suffix = "/" + sourceId;
      if (rawTopic.endsWith(suffix)) {
        return rawTopic.substring(0, rawTopic.length() - suffix.length());
      }
    }
    return rawTopic;
  }

  /**
   * Classifies a raw topic after suffix stripping.
   *
   * @param rawTopic topic as received
   * @param sourceId source identifier from the second message part
   * @return matching topic, or {@link FrameTopic#UNKNOWN}
   */
  public static FrameTopic classify(String rawTopic, String sourceId) {
    return FrameTopic.fromWireName(logicalTopic(rawTopic, sourceId));
  }

  /**
   * Dispatches an envelope to its payload builder.
   *
   * @param envelope decoded envelope
   * @return routed envelope; empty when the topic is unknown
   * @throws DecodeException if a JPEG buffer cannot be decoded
   */
  public Optional<Envelope> route(Envelope envelope) throws DecodeException {
    Objects.requireNonNull(envelope, "envelope");
    return switch (envelope.topic()) {
      case VIDEO, LOG -> Optional.of(envelope);
      case JPEG -> Optional.of(decodeJpeg(envelope));
      case UNKNOWN -> {
        metrics.increment("subscriber.route.unknown");
        log.debug("Discarding envelope from {} with unknown topic", envelope.sourceId());
        yield Optional.empty();
      }
    };
  }

  private Envelope decodeJpeg(Envelope envelope) throws DecodeException {
    if (!(envelope.payload() instanceof ImagePayload jpeg) || jpeg.encoding() != PixelEncoding.JPEG) {
      throw new DecodeException(Stage.BAD_ENCODING, "JpegFrame without a JPEG image payload");
    }
    try {
      return envelope.withPayload(imageCodec.decodeJpeg(jpeg));
    } catch (IOException ex) {
      throw new DecodeException(Stage.BAD_ENCODING, "JPEG decode failed: " + ex.getMessage(), ex);
    }
  }
}
