package ca.gc.cra.ldiftap.api;

import ca.gc.cra.ldiftap.logging.LoggingConfigurator;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code ldif-tap} command dispatcher.
 *
 * @since 0.1.0
 */
public final class Main {
  private static final Logger log = LoggerFactory.getLogger(Main.class);
  private static final String SUMMARY_USAGE = "usage: ldif-tap <extract|discover> [options]";
  private static final String HELP_TEXT = """
      ldif-tap command dispatcher

      Usage:
        ldif-tap <command> [options]

      Commands:
        extract     Parse LDIF files and emit entries (extract --help for details)
        discover    List the LDIF files an extraction would read

      Global flags:
        --help      Show this message
        --verbose   Enable DEBUG logging before dispatching to subcommand
      """;

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args).code());
  }

  static ExitCode run(String[] args) {
    String[] safeArgs = args == null ? new String[0] : args;
    int commandIndex = indexOfCommand(safeArgs);
    if (commandIndex < 0) {
      CliInput input = CliInput.parse(safeArgs);
      if (input.help()) {
        CliPrinter.println(HELP_TEXT.stripTrailing());
        return ExitCode.SUCCESS;
      }
      log.error("Missing command");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    String command = safeArgs[commandIndex].trim().toLowerCase(Locale.ROOT);
    String[] delegateArgs = new String[safeArgs.length - 1];
    System.arraycopy(safeArgs, 0, delegateArgs, 0, commandIndex);
    System.arraycopy(safeArgs, commandIndex + 1, delegateArgs, commandIndex, safeArgs.length - commandIndex - 1);

    if (CliInput.parse(delegateArgs).verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for dispatcher; args={}", Arrays.toString(delegateArgs));
    }

    return switch (command) {
      case "extract" -> ExtractCli.run(delegateArgs);
      case "discover" -> DiscoverCli.run(delegateArgs);
      default -> {
        log.error("Unknown command: {}", command);
        CliPrinter.println(SUMMARY_USAGE);
        yield ExitCode.INVALID_ARGS;
      }
    };
  }

  private static int indexOfCommand(String[] args) {
    for (int i = 0; i < args.length; i++) {
      String arg = args[i];
      if (arg == null) {
        continue;
      }
      String trimmed = arg.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("-") || trimmed.contains("=")
          || trimmed.equalsIgnoreCase("help")) {
        continue;
      }
      return i;
    }
    return -1;
  }
}
