package ca.gc.cra.frametap.domain.frame;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;

/**
 * Body of an {@link Envelope}: either an image with its annotation or a bare log record.
 *
 * @since 0.1.0
 */
public sealed interface Payload permits ImagePayload, LogPayload {
  /**
   * Returns the publisher-supplied annotation; never {@code null}.
   *
   * @return annotation mapping, possibly empty
   */
  MappingValue annotation();
}
