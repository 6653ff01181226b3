package ca.gc.cra.ldiftap.api;

import ca.gc.cra.ldiftap.application.pipeline.ExtractionReport;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort.DiscoveryResult;
import ca.gc.cra.ldiftap.application.port.MetricsPort;
import ca.gc.cra.ldiftap.config.CompositionRoot;
import ca.gc.cra.ldiftap.config.OutputMode;
import ca.gc.cra.ldiftap.config.TapConfig;
import ca.gc.cra.ldiftap.domain.ldif.LdifParseException;
import ca.gc.cra.ldiftap.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ldiftap.logging.LoggingConfigurator;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ldif-tap extract}: parses LDIF files and emits one record per entry to stdout, a file or Kafka.
 *
 * @since 0.1.0
 */
public final class ExtractCli {
  private static final Logger log = LoggerFactory.getLogger(ExtractCli.class);
  private static final String SUMMARY_USAGE =
      "usage: extract filePath=FILE|directoryPath=DIR [filePattern=GLOB] [encoding=CHARSET] "
          + "[baseDnFilter=DN] [objectClassFilter=A,B] [attributeFilter=A,B] [excludeAttributes=A,B] "
          + "[includeOperationalAttributes=true|false] [strictParsing=true|false] [batchSize=N] "
          + "[output=STDOUT|FILE|KAFKA] [out=FILE] [kafkaBootstrap=HOST:PORT] [kafkaTopic=TOPIC] "
          + "[config=PATH] [--dry-run] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      ldif-tap extract

      Usage:
        extract directoryPath=./exports output=FILE out=./entries.ndjson [options]

      Input (at least one):
        filePath=FILE                 Single LDIF file
        directoryPath=DIR             Directory scanned (non-recursively) for LDIF files

      Parsing:
        filePattern=GLOB              File name glob inside directoryPath (default *.ldif)
        encoding=CHARSET              Charset of the LDIF files (default UTF-8)
        strictParsing=true|false      Abort a file on malformed input (default true)
        maxFileSizeMb=N               Skip files larger than N MiB (1..1000, default 100)

      Filters:
        baseDnFilter=DN               Keep entries whose DN ends with DN (case-insensitive)
        objectClassFilter=A,B         Keep entries having any of the object classes
        attributeFilter=A,B           Keep only these attributes
        excludeAttributes=A,B         Drop these attributes
        operationalAttributes=A,B     Replace the list of operational attributes
        includeOperationalAttributes=true|false  Keep operational attributes (default false)

      Output:
        output=STDOUT|FILE|KAFKA      Destination (default STDOUT, NDJSON)
        out=FILE                      NDJSON file when output=FILE
        kafkaBootstrap=HOST:PORT[,..] Required when output=KAFKA
        kafkaTopic=TOPIC              Kafka topic (default ldif.entries)
        batchSize=N                   Entries per sink write (1..10000, default 1000)

      Other:
        config=PATH                   YAML file with common/extract sections
        metricsExporter=otlp|none     Metrics exporter (default otlp)
        otelEndpoint=URL              OTLP endpoint when exporter=otlp
        otelResourceAttributes=K=V    Comma-separated OTel resource attributes
        --dry-run                     Print discovered files and filters without parsing
        --verbose                     Enable DEBUG logging
        --help                        Show this message
      """;

  private ExtractCli() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for extract CLI");
    }

    TapCliSupport.Resolution resolution = TapCliSupport.resolve("extract", input, SUMMARY_USAGE);
    if (resolution.config().isEmpty()) {
      return resolution.failure();
    }
    TapConfig config = resolution.config().get();

    if (config.dryRun()) {
      return printDryRunPlan(config);
    }

    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter()) {
      CompositionRoot root = new CompositionRoot(config, metrics);
      log.info("Configured extraction: output={}, encoding={}, batchSize={}, filters: {}",
          config.output(), config.encoding().name(), config.batchSize(),
          TapCliSupport.describe(config.filterPolicy()));
      ExtractionReport report = root.extractUseCase().run();
      if (config.output() != OutputMode.STDOUT) {
        CliPrinter.printReport("Extraction complete.", summary(report));
      }
      for (ExtractionReport.FileFailure failure : report.failures()) {
        log.warn("File abandoned: {} ({})", failure.file(), failure.message());
      }
      return ExitCode.SUCCESS;
    } catch (LdifParseException ex) {
      log.error("Malformed LDIF: {}", ex.getMessage());
      return ExitCode.RUNTIME_FAILURE;
    } catch (IOException ex) {
      log.error("Extraction I/O failure: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (UncheckedIOException ex) {
      log.error("Extraction I/O failure: {}", ex.getMessage(), ex.getCause());
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in extraction", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception in extraction", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static ExitCode printDryRunPlan(TapConfig config) {
    DiscoveryResult discovered;
    try {
      discovered = new CompositionRoot(config, MetricsPort.NO_OP)
          .discovery()
          .discover();
    } catch (IOException ex) {
      log.error("Unable to list LDIF input: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
    Map<String, Object> plan = new LinkedHashMap<>();
    plan.put("Encoding", config.encoding().name());
    plan.put("Filters", TapCliSupport.describe(config.filterPolicy()));
    plan.put("Output", config.output()
        + config.out().map(path -> " -> " + path).orElse("")
        + (config.output() == OutputMode.KAFKA
            ? " -> " + config.kafkaBootstrap().orElse("<none>") + "/" + config.kafkaTopic() : ""));
    plan.put("Batch size", config.batchSize());
    List<String> lines = new ArrayList<>(CliPrinter.report("Extract dry-run: no entries will be emitted.", plan));
    lines.addAll(DiscoverCli.format(discovered));
    lines.add(" Re-run without --dry-run to extract entries.");
    CliPrinter.printLines(lines.toArray(String[]::new));
    return ExitCode.SUCCESS;
  }

  static Map<String, Object> summary(ExtractionReport report) {
    Map<String, Object> fields = new LinkedHashMap<>();
    fields.put("Files processed", report.filesProcessed());
    fields.put("Files failed", report.filesFailed());
    fields.put("Files ignored", report.filesIgnored());
    fields.put("Entries emitted", report.entriesEmitted());
    fields.put("Entries filtered", report.entriesFiltered());
    fields.put("Lines skipped", report.linesSkipped());
    fields.put("Values dropped", report.valuesDropped());
    return fields;
  }
}
