package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.frame.Envelope;
import ca.gc.cra.frametap.domain.frame.MultipartMessage;

/**
 * Converts between multipart wire messages and envelopes.
 *
 * @since 0.1.0
 */
public interface FrameCodec {
  /**
   * Decodes a wire message. Pure; never throws anything other than {@link DecodeException}.
   *
   * @param message received parts
   * @return decoded envelope
   * @throws DecodeException classifying the failing stage
   */
  Envelope decode(MultipartMessage message) throws DecodeException;

  /**
   * Encodes an envelope for publishing.
   *
   * @param envelope envelope with a known topic
   * @param appendSourceSuffix whether part 0 becomes {@code <topic>/<source_id>}
   * @return wire message
   * @throws IllegalArgumentException if the envelope topic is unknown or mismatches its payload
   */
  MultipartMessage encode(Envelope envelope, boolean appendSourceSuffix);
}
