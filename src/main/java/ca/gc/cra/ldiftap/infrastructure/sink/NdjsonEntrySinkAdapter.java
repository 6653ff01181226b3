package ca.gc.cra.ldiftap.infrastructure.sink;

import ca.gc.cra.ldiftap.application.port.EntrySinkPort;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import java.io.BufferedWriter;
import java.io.IOException;
import java.io.OutputStream;
import java.io.OutputStreamWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Writes entries as newline-delimited JSON (one object per line).
 * <p><strong>Role:</strong> Default {@link EntrySinkPort} for the {@code STDOUT} and {@code FILE} output modes.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; driven by the single extraction thread.</p>
 *
 * @implNote Standard output is flushed but never closed.
 * @since 0.1.0
 */
public final class NdjsonEntrySinkAdapter implements EntrySinkPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonEntrySinkAdapter.class);

  private final Writer writer;
  private final boolean closeTarget;
  private final String description;
  private final EntryJsonWriter json = new EntryJsonWriter();
  private long written;
  private boolean closed;

  NdjsonEntrySinkAdapter(Writer writer, boolean closeTarget, String description) {
    this.writer = Objects.requireNonNull(writer, "writer");
    this.closeTarget = closeTarget;
    this.description = Objects.requireNonNull(description, "description");
  }

  /**
   * Creates a sink that truncates and writes {@code file} in UTF-8.
   *
   * @param file output file
   * @return file-backed sink
   * @throws IOException if the file cannot be opened
   */
  public static NdjsonEntrySinkAdapter toFile(Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    return new NdjsonEntrySinkAdapter(Files.newBufferedWriter(file, StandardCharsets.UTF_8), true, file.toString());
  }

  /**
   * Creates a sink writing to the given stream without taking ownership of it.
   *
   * @param out target stream, typically {@link System#out}
   * @return stream-backed sink
   */
  public static NdjsonEntrySinkAdapter toStream(OutputStream out) {
    Objects.requireNonNull(out, "out");
    Writer writer = new BufferedWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8));
    return new NdjsonEntrySinkAdapter(writer, false, "stdout");
  }

  @Override
  public void write(List<LdifEntry> batch) throws IOException {
    Objects.requireNonNull(batch, "batch");
    if (closed) {
      throw new IllegalStateException("sink already closed");
    }
    for (LdifEntry entry : batch) {
      writer.write(json.toJson(entry));
      writer.write('\n');
    }
    written += batch.size();
  }

  @Override
  public void flush() throws IOException {
    if (!closed) {
      writer.flush();
    }
  }

  @Override
  public void close() throws IOException {
    if (closed) {
      return;
    }
    closed = true;
    writer.flush();
    if (closeTarget) {
      writer.close();
    }
    log.info("NDJSON sink {} closed after {} entries", description, written);
  }
}
