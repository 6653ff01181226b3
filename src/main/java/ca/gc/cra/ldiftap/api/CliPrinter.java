package ca.gc.cra.ldiftap.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Writes user-facing CLI output (help, dry-run plans, discovery listings, run summaries) to standard output.
 *
 * @since 0.1.0
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final int LABEL_WIDTH = 18;
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  public static void println(String message) {
    writer().println(message);
  }

  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter writer = writer();
    for (String line : lines) {
      writer.println(line);
    }
  }

  /**
   * Prints a heading followed by one aligned {@code label : value} line per field.
   *
   * @param heading first line of the report
   * @param fields labels mapped to values, printed in iteration order
   */
  public static void printReport(String heading, Map<String, ?> fields) {
    printLines(report(heading, fields).toArray(String[]::new));
  }

  static List<String> report(String heading, Map<String, ?> fields) {
    List<String> lines = new ArrayList<>(fields.size() + 1);
    lines.add(heading);
    fields.forEach((label, value) -> lines.add(String.format(" %-" + LABEL_WIDTH + "s: %s", label, value)));
    return lines;
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
