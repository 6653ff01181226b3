package ca.gc.cra.ldiftap.domain.ldif;

import java.util.Objects;

/**
 * Malformed-input condition detected while parsing an LDIF file.
 *
 * <p>Issues are values: the parser reports them and the caller decides, from the strictness flag,
 * whether the file is aborted or the offending line/value is skipped.</p>
 *
 * @param kind category of the problem
 * @param lineNumber 1-based line the problem was detected on; {@code 0} when not line-specific
 * @param message human-readable description
 * @since 0.1.0
 */
public record LdifIssue(Kind kind, int lineNumber, String message) {

  /** Categories of malformed input. */
  public enum Kind {
    /** The file cannot be decoded with the configured charset. */
    DECODE,
    /** A {@code name:: value} attribute holds invalid base64. */
    INVALID_BASE64,
    /** A line inside an entry matches no LDIF production. */
    UNPARSEABLE_LINE
  }

  public LdifIssue {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(message, "message");
    if (lineNumber < 0) {
      throw new IllegalArgumentException("lineNumber must not be negative");
    }
  }
}
