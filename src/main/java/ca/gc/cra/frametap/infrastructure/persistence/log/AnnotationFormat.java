package ca.gc.cra.frametap.infrastructure.persistence.log;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import java.io.IOException;
import java.io.Writer;

/**
 * Serialization strategy for annotation log files.
 *
 * @since 0.1.0
 */
public interface AnnotationFormat {
  /**
   * File extension including the leading dot.
   *
   * @return extension such as {@code .jsonl}
   */
  String extension();

  /**
   * Writes any preamble required when a file is opened.
   *
   * @param out destination
   * @throws IOException if writing fails
   */
  void writeHeader(Writer out) throws IOException;

  /**
   * Writes one record, including its line terminator.
   *
   * @param out destination
   * @param record annotation mapping
   * @throws IOException if writing fails
   */
  void writeRecord(Writer out, MappingValue record) throws IOException;
}
