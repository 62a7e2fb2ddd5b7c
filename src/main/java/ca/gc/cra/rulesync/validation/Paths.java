package ca.gc.cra.rulesync.validation;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation utilities for the cache, work and output directories.
 * <p><strong>Why:</strong> A sync run writes into several directories; failing fast on a non-writable
 * location beats discovering it after minutes of downloads.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem
 * semantics.</p>
 * <p><strong>Observability:</strong> Emits no metrics or logs; callers surface validation exceptions.</p>
 *
 * @implNote Existence checks use {@link LinkOption#NOFOLLOW_LINKS} so a dangling symlink is reported rather
 * than silently followed.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable directory, optionally creating it.
   *
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @return absolute normalized path
   * @throws IllegalArgumentException if the path is malformed, not a directory, not writable, or creation fails
   */
  public static Path validateWritableDir(Path path, boolean createIfMissing) {
    if (path == null) {
      throw new IllegalArgumentException("path must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0) {
      throw new IllegalArgumentException("path must not contain null bytes");
    }
    if (containsControl(raw)) {
      throw new IllegalArgumentException("path must not contain control characters");
    }

    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (!Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        if (!createIfMissing) {
          return normalized;
        }
        Files.createDirectories(normalized);
      }
      if (!Files.isDirectory(normalized)) {
        throw new IllegalArgumentException("path is not a directory: " + normalized);
      }
      if (!Files.isWritable(normalized)) {
        throw new IllegalArgumentException("directory is not writable: " + normalized);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException("unable to validate directory " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  /**
   * Resolves {@code fileName} inside {@code directory}, rejecting names that escape it.
   *
   * @param directory parent directory
   * @param fileName single path segment
   * @return resolved child path
   * @throws IllegalArgumentException if {@code fileName} contains separators or resolves outside {@code directory}
   */
  public static Path resolveChild(Path directory, String fileName) {
    Path base = directory.toAbsolutePath().normalize();
    Path child = base.resolve(fileName).normalize();
    if (!child.startsWith(base) || child.equals(base) || !base.equals(child.getParent())) {
      throw new IllegalArgumentException("file name escapes directory: " + fileName);
    }
    return child;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }
}
