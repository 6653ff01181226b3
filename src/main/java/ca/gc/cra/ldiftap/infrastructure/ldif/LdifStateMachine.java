package ca.gc.cra.ldiftap.infrastructure.ldif;

import ca.gc.cra.ldiftap.domain.ldif.EntryAssembler;
import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;
import ca.gc.cra.ldiftap.infrastructure.ldif.LineOutcome.LineKind;
import ca.gc.cra.ldiftap.logging.Logs;
import java.nio.ByteBuffer;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Line-by-line LDIF recognizer that turns {@link RawLine}s into finalized {@link LdifEntry}
 * values.
 * <p><strong>Why:</strong> Keeps the classification rules in one place so the iterator in {@link LdifEntryReader}
 * only deals with laziness, strictness and resource ownership.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Classify each line (blank, comment, continuation, DN, attribute, separator, version, unparseable).</li>
 *   <li>Hold the most recent value until no further continuation can follow, then decode and store it.</li>
 *   <li>Finalize the open entry when a new DN line or end of input arrives and apply entry-level filters.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one instance per file.</p>
 *
 * @since 0.1.0
 */
final class LdifStateMachine {
  private static final Logger log = LoggerFactory.getLogger(LdifStateMachine.class);

  private static final Pattern DN_LINE = Pattern.compile("^(?i:dn)(::?)(.*)$");
  private static final Pattern ATTRIBUTE_LINE =
      Pattern.compile("^([A-Za-z0-9][A-Za-z0-9.-]*(?:;[A-Za-z0-9-]+)*)(::|:<|:)(.*)$");
  private static final Pattern VERSION_LINE = Pattern.compile("^(?i:version):\\s*\\d+\\s*$");
  private static final Pattern WHITESPACE = Pattern.compile("\\s+");

  private final EntryFilterPolicy policy;
  private final String sourceFile;
  private final ParseStatistics statistics;
  private EntryAssembler current;
  private PendingValue pending;

  LdifStateMachine(EntryFilterPolicy policy, String sourceFile, ParseStatistics statistics) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
  }

  /**
   * Handles one physical line.
   *
   * @param line line to classify
   * @return classification, any detected issue and an entry completed by this line
   */
  LineOutcome accept(RawLine line) {
    String text = line.text();
    if (text.stripTrailing().isEmpty()) {
      return LineOutcome.of(LineKind.BLANK);
    }
    if (text.charAt(0) == '#') {
      return LineOutcome.of(LineKind.COMMENT);
    }
    if (text.charAt(0) == ' ') {
      return continuation(line);
    }
    Matcher dn = DN_LINE.matcher(text);
    if (dn.matches()) {
      return startEntry(line, dn);
    }
    if (current == null) {
      if (VERSION_LINE.matcher(text).matches()) {
        return LineOutcome.of(LineKind.VERSION);
      }
      log.debug("Ignoring line {} of {} outside any entry", line.number(), sourceFile);
      return LineOutcome.of(LineKind.OUTSIDE_ENTRY);
    }
    if (text.charAt(0) == '-') {
      current.addBytes(line.byteLength());
      return LineOutcome.of(LineKind.SEPARATOR);
    }
    Matcher attribute = ATTRIBUTE_LINE.matcher(text);
    if (attribute.matches()) {
      Optional<LdifIssue> issue = commitPending();
      pending = PendingValue.attribute(
          attribute.group(1), Encoding.fromSeparator(attribute.group(2)), attribute.group(3), line.number());
      current.addBytes(line.byteLength());
      return new LineOutcome(LineKind.ATTRIBUTE, issue, Optional.empty());
    }
    return LineOutcome.withIssue(LineKind.UNPARSEABLE, new LdifIssue(
        LdifIssue.Kind.UNPARSEABLE_LINE,
        line.number(),
        "unparseable line: " + Logs.preview(text)));
  }

  /**
   * Flushes the pending value and the open entry at end of input.
   *
   * @return end-of-input outcome carrying the last entry, if any
   */
  LineOutcome finish() {
    Optional<LdifIssue> issue = commitPending();
    return new LineOutcome(LineKind.END_OF_INPUT, issue, finalizeCurrent());
  }

  private LineOutcome continuation(RawLine line) {
    if (current == null) {
      return LineOutcome.of(LineKind.OUTSIDE_ENTRY);
    }
    if (pending == null) {
      return LineOutcome.withIssue(LineKind.UNPARSEABLE, new LdifIssue(
          LdifIssue.Kind.UNPARSEABLE_LINE,
          line.number(),
          "continuation line without a preceding value"));
    }
    pending.append(line.text().substring(1));
    current.addBytes(line.byteLength());
    return LineOutcome.of(LineKind.CONTINUATION);
  }

  private LineOutcome startEntry(RawLine line, Matcher dn) {
    Optional<LdifIssue> issue = commitPending();
    Optional<LdifEntry> completed = finalizeCurrent();
    current = new EntryAssembler(policy, sourceFile, line.number());
    current.addBytes(line.byteLength());
    pending = PendingValue.dn(Encoding.fromSeparator(dn.group(1)), dn.group(2), line.number());
    return new LineOutcome(LineKind.DN, issue, completed);
  }

  private Optional<LdifIssue> commitPending() {
    if (pending == null) {
      return Optional.empty();
    }
    PendingValue value = pending;
    pending = null;
    String decoded;
    if (value.encoding() == Encoding.BASE64) {
      String subject = value.isDn() ? "dn" : value.attributeName();
      try {
        decoded = decodeBase64(value.text(), subject);
      } catch (IllegalArgumentException ex) {
        return Optional.of(new LdifIssue(
            LdifIssue.Kind.INVALID_BASE64,
            value.lineNumber(),
            "invalid base64 value for " + subject + ": " + ex.getMessage()));
      }
    } else {
      decoded = value.encoding() == Encoding.URL ? value.text().strip() : value.text().stripLeading();
    }
    if (value.isDn()) {
      current.dn(decoded);
    } else {
      current.add(value.attributeName(), decoded);
    }
    return Optional.empty();
  }

  private Optional<LdifEntry> finalizeCurrent() {
    if (current == null) {
      return Optional.empty();
    }
    EntryAssembler done = current;
    current = null;
    Optional<LdifEntry> built = done.build();
    if (built.isEmpty()) {
      statistics.entryWithoutDn();
      log.debug("Dropping entry at line {} of {} without a DN", done.lineNumber(), sourceFile);
      return Optional.empty();
    }
    if (!policy.acceptsEntry(built.get())) {
      statistics.entryFiltered();
      log.debug("Entry {} at line {} of {} rejected by entry filters", built.get().dn(), done.lineNumber(),
          sourceFile);
      return Optional.empty();
    }
    return built;
  }

  /**
   * Decodes a base64 value. Whitespace anywhere in the payload is ignored. Payloads that are valid UTF-8 become
   * text; other binary payloads are kept in canonical base64 form.
   */
  static String decodeBase64(String text, String subject) {
    byte[] bytes = Base64.getDecoder().decode(WHITESPACE.matcher(text).replaceAll(""));
    try {
      return StandardCharsets.UTF_8.newDecoder()
          .onMalformedInput(CodingErrorAction.REPORT)
          .onUnmappableCharacter(CodingErrorAction.REPORT)
          .decode(ByteBuffer.wrap(bytes))
          .toString();
    } catch (CharacterCodingException ex) {
      log.debug("Keeping binary value of {} ({} bytes) base64-encoded", subject, bytes.length);
      return Base64.getEncoder().encodeToString(bytes);
    }
  }

  private enum Encoding {
    PLAIN,
    BASE64,
    URL;

    static Encoding fromSeparator(String separator) {
      return switch (separator) {
        case "::" -> BASE64;
        case ":<" -> URL;
        default -> PLAIN;
      };
    }
  }

  /** Value whose text may still grow through continuation lines. */
  private static final class PendingValue {
    private final String attributeName;
    private final Encoding encoding;
    private final int lineNumber;
    private final StringBuilder text;

    private PendingValue(String attributeName, Encoding encoding, String text, int lineNumber) {
      this.attributeName = attributeName;
      this.encoding = encoding;
      this.lineNumber = lineNumber;
      this.text = new StringBuilder(text);
    }

    static PendingValue dn(Encoding encoding, String text, int lineNumber) {
      return new PendingValue(null, encoding, text, lineNumber);
    }

    static PendingValue attribute(String name, Encoding encoding, String text, int lineNumber) {
      return new PendingValue(name, encoding, text, lineNumber);
    }

    boolean isDn() {
      return attributeName == null;
    }

    String attributeName() {
      return attributeName;
    }

    Encoding encoding() {
      return encoding;
    }

    int lineNumber() {
      return lineNumber;
    }

    String text() {
      return text.toString();
    }

    void append(String more) {
      text.append(more);
    }
  }
}
