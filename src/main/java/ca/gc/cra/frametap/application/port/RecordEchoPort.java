package ca.gc.cra.frametap.application.port;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;

/**
 * Receives each log-frame record for operator consoles.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface RecordEchoPort {
  /**
   * Emits a record, reserved keys already merged in.
   *
   * @param record annotation mapping of a log frame
   */
  void echo(MappingValue record);

  /** Echo port that discards everything; used in quiet mode. */
  RecordEchoPort SILENT = record -> {};
}
