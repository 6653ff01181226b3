package ca.gc.cra.ldiftap.validation;

import java.nio.file.Files;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for configured input and output locations.
 * <p><strong>Why:</strong> Reports a missing LDIF file or directory as a configuration error instead of a failure
 * halfway through a run.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; results reflect the filesystem at call time.</p>
 *
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates that a path names an existing, readable regular file.
   *
   * @param name parameter name used in diagnostics
   * @param path candidate path
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the file is missing, not regular or unreadable
   */
  public static Path validateReadableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.exists(normalized)) {
      throw new IllegalArgumentException(name + " does not exist: " + normalized);
    }
    if (!Files.isRegularFile(normalized)) {
      throw new IllegalArgumentException(name + " is not a regular file: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates that a path names an existing, readable directory.
   *
   * @param name parameter name used in diagnostics
   * @param path candidate path
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the directory is missing or unreadable
   */
  public static Path validateReadableDir(String name, Path path) {
    Path normalized = normalize(name, path);
    if (!Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is not an existing directory: " + normalized);
    }
    if (!Files.isReadable(normalized)) {
      throw new IllegalArgumentException(name + " is not readable: " + normalized);
    }
    return normalized;
  }

  /**
   * Validates an output file location: the parent directory must exist and be writable and the path must not
   * be a directory.
   *
   * @param name parameter name used in diagnostics
   * @param path candidate output file
   * @return absolute, normalized path
   * @throws IllegalArgumentException if the file cannot be created at that location
   */
  public static Path validateWritableFile(String name, Path path) {
    Path normalized = normalize(name, path);
    if (Files.isDirectory(normalized)) {
      throw new IllegalArgumentException(name + " is a directory: " + normalized);
    }
    Path parent = normalized.getParent();
    if (parent == null || !Files.isDirectory(parent)) {
      throw new IllegalArgumentException(name + " parent directory does not exist: " + parent);
    }
    if (!Files.isWritable(parent)) {
      throw new IllegalArgumentException(name + " parent directory is not writable: " + parent);
    }
    return normalized;
  }

  private static Path normalize(String name, Path path) {
    if (path == null) {
      throw new IllegalArgumentException(name + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException(name + " must not contain null bytes");
    }
    return path.toAbsolutePath().normalize();
  }
}
