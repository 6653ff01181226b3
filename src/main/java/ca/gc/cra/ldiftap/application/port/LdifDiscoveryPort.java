package ca.gc.cra.ldiftap.application.port;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;

/**
 * Port resolving the LDIF files an extraction run should read.
 *
 * @since 0.1.0
 */
public interface LdifDiscoveryPort {
  /**
   * Lists candidate files.
   *
   * @return files to process, in processing order, and files skipped with their reason
   * @throws IOException if a configured path cannot be listed
   */
  DiscoveryResult discover() throws IOException;

  /**
   * Outcome of discovery.
   *
   * @param files readable files to process, in order
   * @param ignored files found but not processed
   */
  record DiscoveryResult(List<Path> files, List<IgnoredFile> ignored) {
    public DiscoveryResult {
      files = List.copyOf(Objects.requireNonNull(files, "files"));
      ignored = List.copyOf(Objects.requireNonNull(ignored, "ignored"));
    }
  }

  /**
   * File excluded from processing.
   *
   * @param path file location
   * @param reason human-readable reason, e.g. size limit exceeded
   */
  record IgnoredFile(Path path, String reason) {
    public IgnoredFile {
      Objects.requireNonNull(path, "path");
      Objects.requireNonNull(reason, "reason");
    }
  }
}
