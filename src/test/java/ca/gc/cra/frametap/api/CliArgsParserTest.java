package ca.gc.cra.frametap.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class CliArgsParserTest {

  @Test
  void splitsOnFirstEquals() {
    Map<String, String> map = CliArgsParser.toMap(new String[] {
        "otelResourceAttributes=service.name=frametap,env=lab", "connect=tcp://a:1"});

    assertEquals("service.name=frametap,env=lab", map.get("otelResourceAttributes"));
    assertEquals("tcp://a:1", map.get("connect"));
    assertEquals(List.of("otelResourceAttributes", "connect"), List.copyOf(map.keySet()));
  }

  @Test
  void emptyValueIsKept() {
    assertEquals("", CliArgsParser.toMap(new String[] {"topics="}).get("topics"));
  }

  @Test
  void laterDuplicateWins() {
    assertEquals("2", CliArgsParser.toMap(new String[] {"fps=1", "fps=2"}).get("fps"));
  }

  @Test
  void nullAndBlankArgumentsAreIgnored() {
    assertTrue(CliArgsParser.toMap(null).isEmpty());
    assertTrue(CliArgsParser.toMap(new String[] {null, "  "}).isEmpty());
  }

  @Test
  void malformedArgumentsAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"imageDir"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"9lives=x"}));
    assertThrows(IllegalArgumentException.class, () -> CliArgsParser.toMap(new String[] {"sourceId=a\u0007b"}));
  }
}
