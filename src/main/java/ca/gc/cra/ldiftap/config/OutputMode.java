package ca.gc.cra.ldiftap.config;

import java.util.Locale;

/**
 * Destination of extracted entries.
 *
 * @since 0.1.0
 */
public enum OutputMode {
  /** NDJSON on standard output. */
  STDOUT,
  /** NDJSON written to the file named by {@code out}. */
  FILE,
  /** One Kafka record per entry. */
  KAFKA;

  /**
   * Parses a mode name case-insensitively.
   *
   * @param value raw value; {@code null} or blank yields {@link #STDOUT}
   * @return parsed mode
   * @throws IllegalArgumentException if the name is unknown
   */
  public static OutputMode fromString(String value) {
    if (value == null || value.isBlank()) {
      return STDOUT;
    }
    try {
      return OutputMode.valueOf(value.trim().toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException ex) {
      throw new IllegalArgumentException("Unknown output: " + value + " (expected STDOUT, FILE or KAFKA)", ex);
    }
  }
}
