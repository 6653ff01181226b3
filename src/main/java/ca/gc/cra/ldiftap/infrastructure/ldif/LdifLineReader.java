package ca.gc.cra.ldiftap.infrastructure.ldif;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.util.Objects;

/**
 * Splits character input into {@link RawLine}s while keeping the encoded size of each original line.
 *
 * <p>Recognizes {@code \n}, {@code \r\n} and bare {@code \r} terminators. A byte-order mark at the start of
 * the first line is removed from the text but still counted in its byte length.</p>
 *
 * <p>Not thread-safe.</p>
 *
 * @since 0.1.0
 */
final class LdifLineReader implements Closeable {
  private static final char BYTE_ORDER_MARK = '\uFEFF';

  private final Reader reader;
  private final Charset charset;
  private final int lfBytes;
  private final int crlfBytes;
  private final int crBytes;
  private final StringBuilder buffer = new StringBuilder(128);
  private int lineNumber;
  private int lookahead = -2;

  LdifLineReader(Reader reader, Charset charset) {
    Objects.requireNonNull(reader, "reader");
    this.reader = reader instanceof BufferedReader ? reader : new BufferedReader(reader);
    this.charset = Objects.requireNonNull(charset, "charset");
    this.lfBytes = encodedLength("\n");
    this.crlfBytes = encodedLength("\r\n");
    this.crBytes = encodedLength("\r");
  }

  /**
   * Reads the next line.
   *
   * @return next line, or {@code null} at end of input
   * @throws IOException if the underlying reader fails or input cannot be decoded
   */
  RawLine next() throws IOException {
    buffer.setLength(0);
    int terminatorBytes;
    while (true) {
      int c = read();
      if (c == -1) {
        if (buffer.length() == 0) {
          return null;
        }
        terminatorBytes = 0;
        break;
      }
      if (c == '\n') {
        terminatorBytes = lfBytes;
        break;
      }
      if (c == '\r') {
        int following = read();
        if (following == '\n') {
          terminatorBytes = crlfBytes;
        } else {
          lookahead = following;
          terminatorBytes = crBytes;
        }
        break;
      }
      buffer.append((char) c);
    }
    lineNumber++;
    String original = buffer.toString();
    int byteLength = encodedLength(original) + terminatorBytes;
    String text = original;
    if (lineNumber == 1 && !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK) {
      text = text.substring(1);
    }
    return new RawLine(lineNumber, text, byteLength);
  }

  int lineNumber() {
    return lineNumber;
  }

  @Override
  public void close() throws IOException {
    reader.close();
  }

  private int read() throws IOException {
    if (lookahead != -2) {
      int c = lookahead;
      lookahead = -2;
      return c;
    }
    return reader.read();
  }

  private int encodedLength(String value) {
    return value.isEmpty() ? 0 : value.getBytes(charset).length;
  }
}
