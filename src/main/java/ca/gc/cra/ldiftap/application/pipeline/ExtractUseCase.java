package ca.gc.cra.ldiftap.application.pipeline;

import ca.gc.cra.ldiftap.application.port.EntrySinkPort;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort.DiscoveryResult;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort.IgnoredFile;
import ca.gc.cra.ldiftap.application.port.MetricsPort;
import ca.gc.cra.ldiftap.domain.ldif.LdifEntry;
import ca.gc.cra.ldiftap.domain.ldif.LdifParseException;
import ca.gc.cra.ldiftap.infrastructure.ldif.LdifEntryReader;
import ca.gc.cra.ldiftap.infrastructure.ldif.LdifParser;
import ca.gc.cra.ldiftap.infrastructure.ldif.ParseStatistics;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Reads every discovered LDIF file and forwards its entries to an {@link EntrySinkPort}.
 * <p><strong>Why:</strong> Turns directory exports into a stream of records that downstream systems can index.</p>
 * <p><strong>Role:</strong> Application-layer use case coordinating discovery, parsing and the sink.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Process files strictly sequentially, one {@link LdifEntryReader} at a time.</li>
 *   <li>Buffer at most {@code batchSize} entries before writing them to the sink.</li>
 *   <li>Abort on the first file error in strict mode; record it and continue in lenient mode.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; call {@link #run()} once.</p>
 * <p><strong>Observability:</strong> Emits {@code ldif.*} metrics and sets the {@code ldif.file} MDC key while a
 * file is being read.</p>
 *
 * @since 0.1.0
 */
public final class ExtractUseCase {
  private static final Logger log = LoggerFactory.getLogger(ExtractUseCase.class);
  private static final String MDC_FILE = "ldif.file";

  private final LdifDiscoveryPort discovery;
  private final LdifParser parser;
  private final EntrySinkPort sink;
  private final MetricsPort metrics;
  private final int batchSize;

  /**
   * Creates the use case.
   *
   * @param discovery source of files to read
   * @param parser parser carrying the filter policy and charset
   * @param sink destination for entries; closed when {@link #run()} returns
   * @param metrics metrics port
   * @param batchSize number of entries buffered before each sink write; must be positive
   */
  public ExtractUseCase(
      LdifDiscoveryPort discovery,
      LdifParser parser,
      EntrySinkPort sink,
      MetricsPort metrics,
      int batchSize) {
    this.discovery = Objects.requireNonNull(discovery, "discovery");
    this.parser = Objects.requireNonNull(parser, "parser");
    this.sink = Objects.requireNonNull(sink, "sink");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (batchSize <= 0) {
      throw new IllegalArgumentException("batchSize must be positive");
    }
    this.batchSize = batchSize;
  }

  /**
   * Runs the extraction.
   *
   * @return run summary
   * @throws LdifParseException in strict mode when a file is malformed
   * @throws UncheckedIOException in strict mode when a file cannot be read
   * @throws IOException if discovery fails
   * @throws Exception if the sink fails
   */
  public ExtractionReport run() throws Exception {
    DiscoveryResult discovered = discovery.discover();
    ExtractionReport.Builder report = ExtractionReport.builder();
    for (IgnoredFile ignored : discovered.ignored()) {
      report.fileIgnored();
      metrics.increment("ldif.files.ignored");
    }
    boolean strict = parser.policy().strictParsing();
    log.info("Extracting {} LDIF file(s) ({} ignored, {} mode)",
        discovered.files().size(), discovered.ignored().size(), strict ? "strict" : "lenient");

    List<LdifEntry> batch = new ArrayList<>(Math.min(batchSize, 1024));
    try (EntrySinkPort out = sink) {
      for (Path file : discovered.files()) {
        MDC.put(MDC_FILE, file.toString());
        try {
          extractFile(file, batch, out, report);
          report.fileProcessed();
          metrics.increment("ldif.files.processed");
        } catch (LdifParseException | UncheckedIOException ex) {
          metrics.increment("ldif.files.failed");
          if (strict) {
            log.error("Aborting extraction: {}", ex.getMessage());
            throw ex;
          }
          report.fileFailed(file, ex.getMessage());
          log.warn("Abandoning {}: {}", file, ex.getMessage());
        } finally {
          MDC.remove(MDC_FILE);
        }
      }
      writeBatch(batch, out);
      out.flush();
    }
    ExtractionReport result = report.build();
    log.info("Extraction finished: {} file(s) processed, {} failed, {} entries emitted, {} filtered",
        result.filesProcessed(), result.filesFailed(), result.entriesEmitted(), result.entriesFiltered());
    return result;
  }

  private void extractFile(Path file, List<LdifEntry> batch, EntrySinkPort out, ExtractionReport.Builder report)
      throws Exception {
    log.info("Reading {}", file);
    try (LdifEntryReader reader = open(file)) {
      while (reader.hasNext()) {
        LdifEntry entry = reader.next();
        batch.add(entry);
        report.entryEmitted();
        metrics.increment("ldif.entries.emitted");
        metrics.observe("ldif.entry.sizeBytes", entry.entrySize());
        if (batch.size() >= batchSize) {
          writeBatch(batch, out);
        }
      }
      ParseStatistics stats = reader.statistics();
      report.entriesFiltered(stats.entriesFiltered())
          .linesSkipped(stats.linesSkipped())
          .valuesDropped(stats.valuesDropped());
      metrics.add("ldif.entries.filtered", stats.entriesFiltered());
      metrics.add("ldif.lines.skipped", stats.linesSkipped());
      metrics.add("ldif.values.dropped", stats.valuesDropped());
      log.info("Finished {}: {}", file, stats);
    }
  }

  private LdifEntryReader open(Path file) {
    try {
      return parser.open(file);
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to open " + file, ex);
    }
  }

  private static void writeBatch(List<LdifEntry> batch, EntrySinkPort out) throws Exception {
    if (batch.isEmpty()) {
      return;
    }
    out.write(List.copyOf(batch));
    batch.clear();
  }
}
