package ca.gc.cra.frametap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeReturnsValueWithinBounds() {
    assertEquals(95, Numbers.requireRange("jpegQuality", 95, 1, 100));
  }

  @Test
  void requireRangeRejectsValuesOutsideBounds() {
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("jpegQuality", 0, 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("jpegQuality", 101, 1, 100));
  }

  @Test
  void requireSecondsAtLeastRejectsNonFiniteValues() {
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireSecondsAtLeast("inhibit", Double.NaN, 0));
    assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireSecondsAtLeast("inhibit", Double.POSITIVE_INFINITY, 0));
  }

  @Test
  void requireSecondsAtLeastEnforcesMinimum() {
    assertEquals(0.5, Numbers.requireSecondsAtLeast("inhibit", 0.5, 0));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Numbers.requireSecondsAtLeast("logInterval", 0.5, 1));
    assertEquals("logInterval must be >= 1.0 seconds (was 0.5)", ex.getMessage());
  }
}
