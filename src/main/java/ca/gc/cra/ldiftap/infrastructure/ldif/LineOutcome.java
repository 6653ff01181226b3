package ca.gc.cra.ldiftap.infrastructure.ldif;

import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;
import java.util.Objects;
import java.util.Optional;

/**
 * Result of feeding one line (or end of input) to {@link LdifStateMachine}.
 *
 * @param kind how the line was classified
 * @param issue malformed-input condition detected while handling the line
 * @param completed entry finalized by this line, already past entry-level filters
 * @since 0.1.0
 */
record LineOutcome(LineKind kind, Optional<LdifIssue> issue, Optional<LdifEntry> completed) {

  /** Classification of a physical line. */
  enum LineKind {
    BLANK,
    COMMENT,
    CONTINUATION,
    DN,
    ATTRIBUTE,
    SEPARATOR,
    VERSION,
    OUTSIDE_ENTRY,
    UNPARSEABLE,
    END_OF_INPUT
  }

  LineOutcome {
    Objects.requireNonNull(kind, "kind");
    issue = Objects.requireNonNullElse(issue, Optional.empty());
    completed = Objects.requireNonNullElse(completed, Optional.empty());
  }

  static LineOutcome of(LineKind kind) {
    return new LineOutcome(kind, Optional.empty(), Optional.empty());
  }

  static LineOutcome withIssue(LineKind kind, LdifIssue issue) {
    return new LineOutcome(kind, Optional.of(issue), Optional.empty());
  }
}
