package ca.gc.cra.ldiftap.config;

import ca.gc.cra.ldiftap.adapter.kafka.KafkaEntrySinkAdapter;
import ca.gc.cra.ldiftap.application.pipeline.ExtractUseCase;
import ca.gc.cra.ldiftap.application.port.EntrySinkPort;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort;
import ca.gc.cra.ldiftap.application.port.MetricsPort;
import ca.gc.cra.ldiftap.infrastructure.discovery.FileSystemLdifDiscovery;
import ca.gc.cra.ldiftap.infrastructure.ldif.LdifParser;
import ca.gc.cra.ldiftap.infrastructure.sink.NdjsonEntrySinkAdapter;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires the extract use case to concrete adapters according to {@link TapConfig}.
 * <p><strong>Role:</strong> Single place translating configuration into runnable objects.</p>
 * <p><strong>Thread-safety:</strong> Holds immutable references; factory methods create new instances.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private final TapConfig config;
  private final MetricsPort metrics;
  private final OutputStream stdout;

  /**
   * Creates a composition root writing {@code STDOUT} output to {@link System#out}.
   *
   * @param config validated configuration
   * @param metrics metrics port shared by the pipeline
   */
  public CompositionRoot(TapConfig config, MetricsPort metrics) {
    this(config, metrics, System.out);
  }

  /**
   * Creates a composition root with an explicit stream for {@code STDOUT} output.
   *
   * @param config validated configuration
   * @param metrics metrics port shared by the pipeline
   * @param stdout stream receiving NDJSON when {@code output=STDOUT}; never closed
   */
  public CompositionRoot(TapConfig config, MetricsPort metrics, OutputStream stdout) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.stdout = Objects.requireNonNull(stdout, "stdout");
  }

  public TapConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /** Discovery adapter for the configured file and directory. */
  public LdifDiscoveryPort discovery() {
    return new FileSystemLdifDiscovery(
        config.filePath(), config.directoryPath(), config.filePattern(), config.maxFileSizeBytes());
  }

  /** Parser applying the configured filters, strictness and charset. */
  public LdifParser parser() {
    return new LdifParser(config.filterPolicy(), config.encoding());
  }

  /**
   * Opens the configured sink.
   *
   * @return sink owned by the caller
   * @throws IOException if the output file cannot be opened
   */
  public EntrySinkPort sink() throws IOException {
    return switch (config.output()) {
      case STDOUT -> NdjsonEntrySinkAdapter.toStream(stdout);
      case FILE -> NdjsonEntrySinkAdapter.toFile(config.out().orElseThrow());
      case KAFKA -> new KafkaEntrySinkAdapter(config.kafkaBootstrap().orElseThrow(), config.kafkaTopic());
    };
  }

  /**
   * Builds the extract use case with a freshly opened sink.
   *
   * @return use case ready to run
   * @throws IOException if the sink cannot be opened
   */
  public ExtractUseCase extractUseCase() throws IOException {
    return new ExtractUseCase(discovery(), parser(), sink(), metrics, config.batchSize());
  }
}
