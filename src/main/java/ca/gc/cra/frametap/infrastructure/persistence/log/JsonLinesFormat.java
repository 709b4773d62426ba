package ca.gc.cra.frametap.infrastructure.persistence.log;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.infrastructure.codec.AnnotationJson;
import java.io.IOException;
import java.io.Writer;

/** One compact JSON object per line. */
public final class JsonLinesFormat implements AnnotationFormat {
  @Override
  public String extension() {
    return ".jsonl";
  }

  @Override
  public void writeHeader(Writer out) {
    // no header
  }

  @Override
  public void writeRecord(Writer out, MappingValue record) throws IOException {
    out.write(AnnotationJson.writeString(record));
    out.write('\n');
  }
}
