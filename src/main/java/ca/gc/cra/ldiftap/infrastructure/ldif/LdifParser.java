package ca.gc.cra.ldiftap.infrastructure.ldif;

import ca.gc.cra.ldiftap.domain.ldif.EntryFilterPolicy;
import ca.gc.cra.ldiftap.domain.ldif.LdifIssue;
import ca.gc.cra.ldiftap.domain.ldif.LdifParseException;
import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.CharacterCodingException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * <strong>What:</strong> Entry point for reading LDIF content into {@link LdifEntryReader}s.
 * <p><strong>Role:</strong> Infrastructure adapter used by the extract use case, one reader per file.</p>
 * <p><strong>Thread-safety:</strong> Immutable and shareable; each returned reader is single-owner.</p>
 *
 * @since 0.1.0
 */
public final class LdifParser {
  private static final int VERIFY_BUFFER_CHARS = 8192;

  private final EntryFilterPolicy policy;
  private final Charset charset;

  /**
   * Creates a parser.
   *
   * @param policy filters and strictness applied to every file
   * @param charset encoding of the LDIF files
   */
  public LdifParser(EntryFilterPolicy policy, Charset charset) {
    this.policy = Objects.requireNonNull(policy, "policy");
    this.charset = Objects.requireNonNull(charset, "charset");
  }

  public EntryFilterPolicy policy() {
    return policy;
  }

  public Charset charset() {
    return charset;
  }

  /**
   * Opens a file for lazy parsing.
   *
   * <p>The whole file is first checked to be decodable with the configured charset so that a decode failure
   * never leaves partially emitted entries behind, in strict or lenient mode.</p>
   *
   * @param file LDIF file
   * @return reader positioned before the first entry; the caller must close it
   * @throws IOException if the file cannot be opened
   * @throws LdifParseException with kind {@link LdifIssue.Kind#DECODE} if the file is not valid in the charset
   */
  public LdifEntryReader open(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    verifyDecodable(file);
    BufferedReader reader = Files.newBufferedReader(file, charset);
    return parse(file.toString(), reader);
  }

  /**
   * Parses already-decoded character input.
   *
   * @param sourceName name recorded as {@code source_file} on every entry
   * @param reader character input; ownership passes to the returned reader
   * @return lazy entry reader
   */
  public LdifEntryReader parse(String sourceName, Reader reader) {
    Objects.requireNonNull(sourceName, "sourceName");
    ParseStatistics statistics = new ParseStatistics();
    LdifStateMachine machine = new LdifStateMachine(policy, sourceName, statistics);
    return new LdifEntryReader(
        sourceName, new LdifLineReader(reader, charset), machine, statistics, policy.strictParsing());
  }

  private void verifyDecodable(Path file) throws IOException {
    char[] buffer = new char[VERIFY_BUFFER_CHARS];
    try (BufferedReader reader = Files.newBufferedReader(file, charset)) {
      while (reader.read(buffer) != -1) {
        // drain
      }
    } catch (CharacterCodingException ex) {
      throw new LdifParseException(file.toString(), new LdifIssue(
          LdifIssue.Kind.DECODE, 0, "file is not valid " + charset.name() + ": " + ex), ex);
    }
  }
}
