package ca.gc.cra.ldiftap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;

class NumbersTest {

  @Test
  void requireRangeAcceptsBounds() {
    assertEquals(1, Numbers.requireRange("batchSize", 1, 1, 10));
    assertEquals(10, Numbers.requireRange("batchSize", 10, 1, 10));
  }

  @Test
  void requireRangeRejectsOutside() {
    IllegalArgumentException ex =
        assertThrows(IllegalArgumentException.class, () -> Numbers.requireRange("batchSize", 11, 1, 10));
    assertEquals("batchSize must be between 1 and 10 (was 11)", ex.getMessage());
  }

  @Test
  void parseIntInRangeRejectsNonNumeric() {
    assertEquals(42, Numbers.parseIntInRange("batchSize", " 42 ", 1, 100));
    assertThrows(IllegalArgumentException.class, () -> Numbers.parseIntInRange("batchSize", "many", 1, 100));
  }
}
