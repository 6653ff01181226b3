package ca.gc.cra.ldiftap.infrastructure.ldif;

import java.util.Objects;

/**
 * One physical LDIF line.
 *
 * @param number 1-based line number
 * @param text line content without its CR/LF terminator
 * @param byteLength encoded length of the original line, terminator included
 * @since 0.1.0
 */
public record RawLine(int number, String text, int byteLength) {
  public RawLine {
    Objects.requireNonNull(text, "text");
    if (number < 1) {
      throw new IllegalArgumentException("number must be >= 1");
    }
    if (byteLength < 0) {
      throw new IllegalArgumentException("byteLength must not be negative");
    }
  }
}
