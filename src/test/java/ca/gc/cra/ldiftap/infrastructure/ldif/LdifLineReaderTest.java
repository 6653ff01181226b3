package ca.gc.cra.ldiftap.infrastructure.ldif;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class LdifLineReaderTest {

  @Test
  void splitsOnAllTerminatorsAndCountsTheirBytes() throws IOException {
    try (LdifLineReader reader = new LdifLineReader(new StringReader("a\nbb\r\nccc\rd"), StandardCharsets.UTF_8)) {
      assertLine(reader.next(), 1, "a", 2);
      assertLine(reader.next(), 2, "bb", 4);
      assertLine(reader.next(), 3, "ccc", 4);
      assertLine(reader.next(), 4, "d", 1);
      assertNull(reader.next());
      assertEquals(4, reader.lineNumber());
    }
  }

  @Test
  void keepsEmptyLinesBetweenTerminators() throws IOException {
    try (LdifLineReader reader = new LdifLineReader(new StringReader("\r\n\n"), StandardCharsets.UTF_8)) {
      assertLine(reader.next(), 1, "", 2);
      assertLine(reader.next(), 2, "", 1);
      assertNull(reader.next());
    }
  }

  @Test
  void stripsByteOrderMarkOnlyOnFirstLine() throws IOException {
    try (LdifLineReader reader =
        new LdifLineReader(new StringReader("\uFEFFdn: x\n\uFEFF"), StandardCharsets.UTF_8)) {
      assertLine(reader.next(), 1, "dn: x", 9);
      assertLine(reader.next(), 2, "\uFEFF", 3);
    }
  }

  @Test
  void countsBytesInConfiguredCharset() throws IOException {
    try (LdifLineReader reader = new LdifLineReader(new StringReader("é\n"), StandardCharsets.UTF_16BE)) {
      assertLine(reader.next(), 1, "é", 4);
    }
  }

  private static void assertLine(RawLine line, int number, String text, int bytes) {
    assertEquals(number, line.number());
    assertEquals(text, line.text());
    assertEquals(bytes, line.byteLength());
  }
}
