package ca.gc.cra.ldiftap.domain.ldif;

import java.util.Objects;

/**
 * Unchecked exception aborting the current LDIF file.
 *
 * <p>Raised for every issue in strict mode and for undecodable files in either mode. Unchecked because it
 * surfaces from {@link java.util.Iterator#next()} while entries are pulled lazily.</p>
 *
 * @since 0.1.0
 */
public final class LdifParseException extends RuntimeException {
  private static final long serialVersionUID = 1L;

  private final String sourceFile;
  private final LdifIssue issue;

  /**
   * Creates an exception describing an issue in the given file.
   *
   * @param sourceFile file being parsed
   * @param issue issue that aborted parsing
   */
  public LdifParseException(String sourceFile, LdifIssue issue) {
    this(sourceFile, issue, null);
  }

  /**
   * Creates an exception describing an issue in the given file with an underlying cause.
   *
   * @param sourceFile file being parsed
   * @param issue issue that aborted parsing
   * @param cause root cause, for example a charset decoding failure
   */
  public LdifParseException(String sourceFile, LdifIssue issue, Throwable cause) {
    super(format(sourceFile, issue), cause);
    this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
    this.issue = Objects.requireNonNull(issue, "issue");
  }

  public String sourceFile() {
    return sourceFile;
  }

  public LdifIssue issue() {
    return issue;
  }

  public LdifIssue.Kind kind() {
    return issue.kind();
  }

  public int lineNumber() {
    return issue.lineNumber();
  }

  private static String format(String sourceFile, LdifIssue issue) {
    Objects.requireNonNull(issue, "issue");
    StringBuilder sb = new StringBuilder();
    sb.append(sourceFile);
    if (issue.lineNumber() > 0) {
      sb.append(':').append(issue.lineNumber());
    }
    sb.append(": ").append(issue.message());
    return sb.toString();
  }
}
