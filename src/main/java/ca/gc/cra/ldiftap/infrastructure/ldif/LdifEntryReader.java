package ca.gc.cra.ldiftap.infrastructure.ldif;

import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;
import ca.gc.cra.ldiftap.domain.ldif.LdifParseException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.CharacterCodingException;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Lazy, single-pass sequence of the entries of one LDIF source.
 * <p><strong>Why:</strong> Files may hold millions of entries; pulling them one at a time keeps memory bounded to
 * the entry under construction.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pull lines on demand and surface entries in file order.</li>
 *   <li>Raise {@link LdifParseException} on the first issue in strict mode; log and count issues otherwise.</li>
 *   <li>Release the underlying reader on exhaustion, on failure and on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; not restartable.</p>
 *
 * @since 0.1.0
 */
public final class LdifEntryReader implements Iterator<LdifEntry>, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(LdifEntryReader.class);

  private final String sourceFile;
  private final LdifLineReader lines;
  private final LdifStateMachine machine;
  private final ParseStatistics statistics;
  private final boolean strict;
  private LdifEntry next;
  private boolean exhausted;
  private boolean closed;

  LdifEntryReader(String sourceFile, LdifLineReader lines, LdifStateMachine machine,
      ParseStatistics statistics, boolean strict) {
    this.sourceFile = Objects.requireNonNull(sourceFile, "sourceFile");
    this.lines = Objects.requireNonNull(lines, "lines");
    this.machine = Objects.requireNonNull(machine, "machine");
    this.statistics = Objects.requireNonNull(statistics, "statistics");
    this.strict = strict;
  }

  /**
   * @throws LdifParseException in strict mode when the remaining input is malformed
   * @throws UncheckedIOException if reading fails
   */
  @Override
  public boolean hasNext() {
    if (next != null) {
      return true;
    }
    if (exhausted || closed) {
      return false;
    }
    next = advance();
    return next != null;
  }

  /**
   * @throws LdifParseException in strict mode when the remaining input is malformed
   * @throws UncheckedIOException if reading fails
   */
  @Override
  public LdifEntry next() {
    if (!hasNext()) {
      throw new NoSuchElementException("no more entries in " + sourceFile);
    }
    LdifEntry entry = next;
    next = null;
    return entry;
  }

  /**
   * Exposes the remaining entries as a sequential stream that closes this reader when the stream is closed.
   *
   * @return lazy stream of entries
   */
  public Stream<LdifEntry> stream() {
    Spliterator<LdifEntry> spliterator =
        Spliterators.spliteratorUnknownSize(this, Spliterator.ORDERED | Spliterator.NONNULL);
    return StreamSupport.stream(spliterator, false).onClose(this::close);
  }

  /** Counters for the lines consumed so far. */
  public ParseStatistics statistics() {
    return statistics;
  }

  public String sourceFile() {
    return sourceFile;
  }

  @Override
  public void close() {
    if (closed) {
      return;
    }
    closed = true;
    next = null;
    try {
      lines.close();
    } catch (IOException ex) {
      log.warn("Failed to close LDIF source {}", sourceFile, ex);
    }
  }

  private LdifEntry advance() {
    while (true) {
      RawLine line = readLine();
      LineOutcome outcome;
      if (line == null) {
        exhausted = true;
        outcome = machine.finish();
      } else {
        statistics.lineRead();
        outcome = machine.accept(line);
      }
      outcome.issue().ifPresent(this::handleIssue);
      if (outcome.completed().isPresent()) {
        statistics.entryEmitted();
        if (exhausted) {
          close();
        }
        return outcome.completed().get();
      }
      if (exhausted) {
        close();
        return null;
      }
    }
  }

  private RawLine readLine() {
    try {
      return lines.next();
    } catch (CharacterCodingException ex) {
      close();
      throw new LdifParseException(sourceFile, new LdifIssue(
          LdifIssue.Kind.DECODE, lines.lineNumber() + 1, "cannot decode input: " + ex), ex);
    } catch (IOException ex) {
      close();
      throw new UncheckedIOException("Failed to read " + sourceFile, ex);
    }
  }

  private void handleIssue(LdifIssue issue) {
    if (strict) {
      close();
      throw new LdifParseException(sourceFile, issue);
    }
    statistics.skipped(issue);
    log.warn("Skipping malformed input in {} at line {}: {}", sourceFile, issue.lineNumber(), issue.message());
  }
}
