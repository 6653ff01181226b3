package ca.gc.cra.ldiftap.logging;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

class LogsTest {

  @Test
  void shortValuesAreUnchanged() {
    assertEquals("dn: cn=a", Logs.preview("dn: cn=a"));
    assertEquals("<null>", Logs.preview(null));
  }

  @Test
  void longValuesAreCutOnCharacterBoundary() {
    String value = "é".repeat(10);

    String truncated = Logs.truncate(value, 5);

    assertTrue(truncated.startsWith("éé..."));
    assertTrue(truncated.contains("5 of 20 bytes"));
  }

  @Test
  void rejectsNonPositiveLimit() {
    assertThrows(IllegalArgumentException.class, () -> Logs.truncate("abc", 0));
  }
}
