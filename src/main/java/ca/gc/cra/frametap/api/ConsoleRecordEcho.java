package ca.gc.cra.frametap.api;

import ca.gc.cra.frametap.application.port.RecordEchoPort;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.infrastructure.codec.AnnotationJson;

/** Prints each log-frame record to stdout as one line of compact JSON. */
final class ConsoleRecordEcho implements RecordEchoPort {
  @Override
  public void echo(MappingValue record) {
    CliPrinter.println(AnnotationJson.writeString(record));
  }
}
