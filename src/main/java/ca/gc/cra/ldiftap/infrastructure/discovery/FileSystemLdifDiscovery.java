package ca.gc.cra.ldiftap.infrastructure.discovery;

import ca.gc.cra.ldiftap.application.port.LdifDiscoveryPort;
import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Resolves LDIF input files from a single configured file and/or a directory glob.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Return the configured file first, then regular files directly inside the directory whose name matches
 *   the glob, sorted by name.</li>
 *   <li>Skip files larger than the size limit and report them as ignored.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Immutable; each {@link #discover()} call lists the filesystem again.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemLdifDiscovery implements LdifDiscoveryPort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemLdifDiscovery.class);

  private final Optional<Path> file;
  private final Optional<Path> directory;
  private final String filePattern;
  private final PathMatcher matcher;
  private final long maxFileSizeBytes;

  /**
   * Creates a discovery adapter.
   *
   * @param file optional single input file
   * @param directory optional directory scanned non-recursively
   * @param filePattern glob applied to file names inside {@code directory}
   * @param maxFileSizeBytes files strictly larger than this are ignored; must be positive
   */
  public FileSystemLdifDiscovery(
      Optional<Path> file, Optional<Path> directory, String filePattern, long maxFileSizeBytes) {
    this.file = Objects.requireNonNull(file, "file");
    this.directory = Objects.requireNonNull(directory, "directory");
    this.filePattern = Objects.requireNonNull(filePattern, "filePattern");
    if (file.isEmpty() && directory.isEmpty()) {
      throw new IllegalArgumentException("file or directory must be provided");
    }
    if (maxFileSizeBytes <= 0) {
      throw new IllegalArgumentException("maxFileSizeBytes must be positive");
    }
    this.matcher = FileSystems.getDefault().getPathMatcher("glob:" + filePattern);
    this.maxFileSizeBytes = maxFileSizeBytes;
  }

  @Override
  public DiscoveryResult discover() throws IOException {
    Set<Path> candidates = new LinkedHashSet<>();
    if (file.isPresent()) {
      Path single = file.get().toAbsolutePath().normalize();
      if (!Files.isRegularFile(single)) {
        throw new NoSuchFileException(single.toString(), null, "LDIF file not found");
      }
      candidates.add(single);
    }
    if (directory.isPresent()) {
      candidates.addAll(listDirectory(directory.get().toAbsolutePath().normalize()));
    }

    List<Path> files = new ArrayList<>();
    List<IgnoredFile> ignored = new ArrayList<>();
    for (Path candidate : candidates) {
      long size = Files.size(candidate);
      if (size > maxFileSizeBytes) {
        log.warn("Skipping {}: size {} bytes exceeds limit of {} bytes", candidate, size, maxFileSizeBytes);
        ignored.add(new IgnoredFile(candidate,
            "size " + size + " bytes exceeds limit of " + maxFileSizeBytes + " bytes"));
        continue;
      }
      files.add(candidate);
    }
    log.debug("Discovered {} LDIF file(s), {} ignored", files.size(), ignored.size());
    return new DiscoveryResult(files, ignored);
  }

  private List<Path> listDirectory(Path dir) throws IOException {
    if (!Files.isDirectory(dir)) {
      throw new NoSuchFileException(dir.toString(), null, "LDIF directory not found");
    }
    List<Path> matches = new ArrayList<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(dir)) {
      for (Path child : stream) {
        if (Files.isRegularFile(child) && matcher.matches(child.getFileName())) {
          matches.add(child);
        }
      }
    }
    matches.sort(null);
    log.debug("Directory {} holds {} file(s) matching {}", dir, matches.size(), filePattern);
    return matches;
  }
}
