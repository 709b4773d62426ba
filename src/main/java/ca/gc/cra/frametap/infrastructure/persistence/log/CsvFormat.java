package ca.gc.cra.frametap.infrastructure.persistence.log;

import ca.gc.cra.frametap.domain.annotation.AnnotationValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.BoolValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.MappingValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NullValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.NumberValue;
import ca.gc.cra.frametap.domain.annotation.AnnotationValue.TextValue;
import ca.gc.cra.frametap.infrastructure.codec.AnnotationJson;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Optional;

/**
 * CSV rows restricted to a fixed field list.
 *
 * <p>A header row is written each time a file opens. Unlisted keys are ignored and missing keys are left
 * empty; nested values are written as compact JSON text.</p>
 *
 * @since 0.1.0
 */
public final class CsvFormat implements AnnotationFormat {
  private static final CsvMapper MAPPER = new CsvMapper();

  private final List<String> fields;
  private final ObjectWriter rowWriter;

  /**
   * Creates a CSV format.
   *
   * @param fields ordered column names; must not be empty
   */
  public CsvFormat(List<String> fields) {
    if (fields == null || fields.isEmpty()) {
      throw new IllegalArgumentException("csvFields must name at least one field");
    }
    this.fields = List.copyOf(fields);
    CsvSchema.Builder schema = CsvSchema.builder();
    this.fields.forEach(schema::addColumn);
    this.rowWriter = MAPPER.writer(schema.build());
  }

  /**
   * Returns the configured columns.
   *
   * @return immutable field list
   */
  public List<String> fields() {
    return fields;
  }

  @Override
  public String extension() {
    return ".csv";
  }

  @Override
  public void writeHeader(Writer out) throws IOException {
    out.write(rowWriter.writeValueAsString(fields.toArray(new String[0])));
  }

  @Override
  public void writeRecord(Writer out, MappingValue record) throws IOException {
    String[] row = new String[fields.size()];
    for (int i = 0; i < row.length; i++) {
      row[i] = cell(record.get(fields.get(i)));
    }
    out.write(rowWriter.writeValueAsString(row));
  }

  private static String cell(Optional<AnnotationValue> value) {
    if (value.isEmpty()) {
      return "";
    }
    AnnotationValue v = value.get();
    if (v instanceof NullValue) {
      return "";
    }
    if (v instanceof TextValue text) {
      return text.value();
    }
    if (v instanceof BoolValue || v instanceof NumberValue) {
      return AnnotationJson.toNode(v).asText();
    }
    return AnnotationJson.writeString(v);
  }
}
