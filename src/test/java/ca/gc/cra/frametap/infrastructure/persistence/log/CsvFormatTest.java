package ca.gc.cra.frametap.infrastructure.persistence.log;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import java.io.IOException;
import java.io.StringWriter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CsvFormatTest {

  @Test
  void headerListsFieldsInOrder() throws IOException {
    CsvFormat format = new CsvFormat(List.of("frame_time", "source_id"));
    StringWriter out = new StringWriter();

    format.writeHeader(out);

    assertEquals("frame_time,source_id\n", out.toString());
    assertEquals(".csv", format.extension());
  }

  @Test
  void rowsIgnoreUnlistedKeysAndRenderScalars() throws IOException {
    Map<String, Object> raw = new LinkedHashMap<>();
    raw.put("ok", true);
    raw.put("count", 3);
    raw.put("extra", "dropped");
    raw.put("nothing", null);
    CsvFormat format = new CsvFormat(List.of("count", "ok", "nothing", "absent"));
    StringWriter out = new StringWriter();

    format.writeRecord(out, (MappingValue) AnnotationValue.fromJava(raw));

    assertEquals("3,true,,\n", out.toString());
  }

  @Test
  void nestedValuesAreQuotedJson() throws IOException {
    CsvFormat format = new CsvFormat(List.of("roi"));
    StringWriter out = new StringWriter();

    format.writeRecord(out, (MappingValue) AnnotationValue.fromJava(Map.of("roi", Map.of("w", 4))));

    assertEquals("\"{\"\"w\"\":4}\"\n", out.toString());
  }

  @Test
  void fieldListMustNotBeEmpty() {
    assertThrows(IllegalArgumentException.class, () -> new CsvFormat(List.of()));
  }
}
