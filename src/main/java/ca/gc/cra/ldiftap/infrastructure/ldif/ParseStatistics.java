package ca.gc.cra.ldiftap.infrastructure.ldif;

import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;

/**
 * Counters collected while one LDIF file is parsed.
 *
 * <p>Owned by a single {@link LdifEntryReader}; read by the extract use case once the reader is exhausted.</p>
 *
 * @since 0.1.0
 */
public final class ParseStatistics {
  private long linesRead;
  private long linesSkipped;
  private long valuesDropped;
  private long entriesEmitted;
  private long entriesFiltered;
  private long entriesWithoutDn;

  void lineRead() {
    linesRead++;
  }

  /**
   * Records an issue tolerated in lenient mode.
   *
   * @param issue skipped issue
   */
  void skipped(LdifIssue issue) {
    switch (issue.kind()) {
      case INVALID_BASE64 -> valuesDropped++;
      case UNPARSEABLE_LINE -> linesSkipped++;
      case DECODE -> {
        // decode failures abandon the whole file and are reported by the caller
      }
    }
  }

  void entryEmitted() {
    entriesEmitted++;
  }

  void entryFiltered() {
    entriesFiltered++;
  }

  void entryWithoutDn() {
    entriesWithoutDn++;
  }

  public long linesRead() {
    return linesRead;
  }

  /** Lines skipped in lenient mode because they matched no LDIF production. */
  public long linesSkipped() {
    return linesSkipped;
  }

  /** Attribute values dropped in lenient mode because their base64 payload was invalid. */
  public long valuesDropped() {
    return valuesDropped;
  }

  public long entriesEmitted() {
    return entriesEmitted;
  }

  /** Finalized entries rejected by the base DN or object-class filter. */
  public long entriesFiltered() {
    return entriesFiltered;
  }

  public long entriesWithoutDn() {
    return entriesWithoutDn;
  }

  @Override
  public String toString() {
    return "ParseStatistics{linesRead=" + linesRead
        + ", linesSkipped=" + linesSkipped
        + ", valuesDropped=" + valuesDropped
        + ", entriesEmitted=" + entriesEmitted
        + ", entriesFiltered=" + entriesFiltered
        + ", entriesWithoutDn=" + entriesWithoutDn
        + '}';
  }
}
