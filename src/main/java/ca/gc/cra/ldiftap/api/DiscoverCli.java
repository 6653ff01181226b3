package ca.gc.cra.ldiftap.api;

import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort.DiscoveryResult;
import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort.IgnoredFile;
import ca.gc.cra.ldiftap.application.port.MetricsPort;
import ca.gc.cra.ldiftap.config.CompositionRoot;
import ca.gc.cra.ldiftap.config.TapConfig;
import ca.gc.cra.ldiftap.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ldif-tap discover}: lists the LDIF files an extraction would read, and those it would skip.
 *
 * @since 0.1.0
 */
public final class DiscoverCli {
  private static final Logger log = LoggerFactory.getLogger(DiscoverCli.class);
  private static final String SUMMARY_USAGE =
      "usage: discover filePath=FILE|directoryPath=DIR [filePattern=GLOB] [maxFileSizeMb=N] [config=PATH]";
  private static final String HELP_TEXT = """
      ldif-tap discover

      Usage:
        discover directoryPath=./exports [options]

      Input (at least one):
        filePath=FILE            Single LDIF file
        directoryPath=DIR        Directory scanned (non-recursively) for LDIF files

      Optional:
        filePattern=GLOB         File name glob inside directoryPath (default *.ldif)
        maxFileSizeMb=N          Skip files larger than N MiB (1..1000, default 100)
        config=PATH              YAML file with common/discover sections
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private DiscoverCli() {}

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
      log.debug("Verbose logging enabled for discover CLI");
    }

    TapCliSupport.Resolution resolution = TapCliSupport.resolve("discover", input, SUMMARY_USAGE);
    if (resolution.config().isEmpty()) {
      return resolution.failure();
    }
    TapConfig config = resolution.config().get();

    try {
      DiscoveryResult result = new CompositionRoot(config, MetricsPort.NO_OP).discovery().discover();
      CliPrinter.printLines(format(result).toArray(String[]::new));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to list LDIF input: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
  }

  static List<String> format(DiscoveryResult result) {
    List<String> lines = new ArrayList<>();
    lines.add("Files to process: " + result.files().size());
    for (Path file : result.files()) {
      lines.add("  " + file);
    }
    lines.add("Files ignored: " + result.ignored().size());
    for (IgnoredFile ignored : result.ignored()) {
      lines.add("  " + ignored.path() + " (" + ignored.reason() + ")");
    }
    return lines;
  }
}
