package ca.gc.cra.frametap.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void truncateLeavesShortValuesUntouched() {
    assertEquals("VideoFrame", Logs.truncate("VideoFrame", 64));
    assertEquals("<null>", Logs.truncate(null, 64));
  }

  @Test
  void truncateAppendsOriginalLength() {
    String truncated = Logs.truncate("abcdefghij", 4);
    assertEquals("abcd... (truncated, 4 of 10)", truncated);
  }

  @Test
  void truncateRejectsNonPositiveBudget() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }

  @Test
  void printableMasksControlCharacters() {
    byte[] raw = "Video\nFrame\u0000".getBytes(StandardCharsets.UTF_8);
    String rendered = Logs.printable(raw, 64);
    assertEquals("Video?Frame?", rendered);
  }

  @Test
  void printableTruncatesLongTopics() {
    byte[] raw = "x".repeat(200).getBytes(StandardCharsets.UTF_8);
    assertTrue(Logs.printable(raw, 16).startsWith("x".repeat(16) + "... (truncated"));
    assertEquals("<null>", Logs.printable(null, 16));
  }
}
