package ca.gc.cra.ldiftap.application.pipeline;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Summary of one extraction run.
 *
 * @param filesProcessed files parsed to completion
 * @param filesFailed files abandoned because of a parse or IO failure
 * @param filesIgnored files skipped during discovery (size limit)
 * @param entriesEmitted entries handed to the sink
 * @param entriesFiltered finalized entries rejected by the base DN or object-class filter
 * @param linesSkipped malformed lines skipped in lenient mode
 * @param valuesDropped attribute values dropped in lenient mode because of invalid base64
 * @param failures per-file failure descriptions, in processing order
 * @since 0.1.0
 */
public record ExtractionReport(
    int filesProcessed,
    int filesFailed,
    int filesIgnored,
    long entriesEmitted,
    long entriesFiltered,
    long linesSkipped,
    long valuesDropped,
    List<FileFailure> failures) {

  public ExtractionReport {
    failures = List.copyOf(Objects.requireNonNullElse(failures, List.of()));
  }

  /** Whether every discovered file was parsed without being abandoned. */
  public boolean successful() {
    return filesFailed == 0;
  }

  /**
   * Failure recorded for a single file in lenient mode.
   *
   * @param file file that was abandoned
   * @param message reason
   */
  public record FileFailure(Path file, String message) {
    public FileFailure {
      Objects.requireNonNull(file, "file");
      Objects.requireNonNull(message, "message");
    }
  }

  static Builder builder() {
    return new Builder();
  }

  /** Mutable accumulator owned by {@link ExtractUseCase} during a run. */
  static final class Builder {
    private int filesProcessed;
    private int filesFailed;
    private int filesIgnored;
    private long entriesEmitted;
    private long entriesFiltered;
    private long linesSkipped;
    private long valuesDropped;
    private final List<FileFailure> failures = new ArrayList<>();

    Builder fileProcessed() {
      filesProcessed++;
      return this;
    }

    Builder fileFailed(Path file, String message) {
      filesFailed++;
      failures.add(new FileFailure(file, message));
      return this;
    }

    Builder fileIgnored() {
      filesIgnored++;
      return this;
    }

    Builder entryEmitted() {
      entriesEmitted++;
      return this;
    }

    Builder entriesFiltered(long count) {
      entriesFiltered += count;
      return this;
    }

    Builder linesSkipped(long count) {
      linesSkipped += count;
      return this;
    }

    Builder valuesDropped(long count) {
      valuesDropped += count;
      return this;
    }

    ExtractionReport build() {
      return new ExtractionReport(
          filesProcessed,
          filesFailed,
          filesIgnored,
          entriesEmitted,
          entriesFiltered,
          linesSkipped,
          valuesDropped,
          failures);
    }
  }
}
