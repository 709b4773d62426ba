package ca.gc.cra.frametap.validation;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;

/**
 * <strong>What:</strong> Filesystem validation for the image and log output directories.
 * <p><strong>Why:</strong> Atomic renames only hold within one directory that the process can write to; a bad
 * directory must fail at startup rather than drop every frame at runtime.</p>
 * <p><strong>Thread-safety:</strong> Stateless methods; concurrency limited by underlying filesystem semantics.</p>
 *
 * @implNote Checks use {@link LinkOption#NOFOLLOW_LINKS} so a symlinked output directory is reported as-is.
 * @since 0.1.0
 * @see Strings
 */
public final class Paths {
  private Paths() {
    // Utility
  }

  /**
   * Validates a writable output directory, optionally creating it.
   *
   * @param name logical option name used in diagnostics (e.g., {@code imageDir})
   * @param path candidate directory; must not be {@code null}
   * @param createIfMissing whether to create the directory (and parents) when absent
   * @param allowReuse when {@code false}, existing non-empty directories are rejected
   * @return real path when the directory exists, otherwise the absolute normalized path
   * @throws IllegalArgumentException if the directory cannot be used for output
   */
  public static Path validateWritableDir(
      String name, Path path, boolean createIfMissing, boolean allowReuse) {
    String label = name == null || name.isBlank() ? "path" : name;
    if (path == null) {
      throw new IllegalArgumentException(label + " must not be null");
    }
    String raw = path.toString();
    if (raw.indexOf('\0') >= 0 || containsControl(raw)) {
      throw new IllegalArgumentException(label + " must not contain control characters");
    }
    Path normalized = path.toAbsolutePath().normalize();
    try {
      if (Files.exists(normalized, LinkOption.NOFOLLOW_LINKS)) {
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureUsable(label, real, allowReuse);
        return real;
      }
      if (createIfMissing) {
        Files.createDirectories(normalized);
        Path real = normalized.toRealPath(LinkOption.NOFOLLOW_LINKS);
        ensureUsable(label, real, true);
        return real;
      }
      Path ancestor = nearestExistingAncestor(normalized);
      if (!Files.isDirectory(ancestor) || !Files.isWritable(ancestor)) {
        throw new IllegalArgumentException(
            label + " cannot be created under non-writable " + ancestor);
      }
      return normalized;
    } catch (IOException ex) {
      throw new IllegalArgumentException(
          "unable to validate " + label + " " + normalized + ": " + ex.getMessage(), ex);
    }
  }

  private static void ensureUsable(String label, Path dir, boolean allowReuse) throws IOException {
    if (!Files.isDirectory(dir, LinkOption.NOFOLLOW_LINKS)) {
      throw new IllegalArgumentException(label + " is not a directory: " + dir);
    }
    if (!Files.isWritable(dir)) {
      throw new IllegalArgumentException(label + " is not writable: " + dir);
    }
    if (!allowReuse) {
      try (DirectoryStream<Path> entries = Files.newDirectoryStream(dir)) {
        if (entries.iterator().hasNext()) {
          throw new IllegalArgumentException(
              label + " " + dir + " is not empty; re-run with --allow-overwrite to reuse");
        }
      }
    }
  }

  private static Path nearestExistingAncestor(Path start) {
    Path current = start.getParent();
    while (current != null && !Files.exists(current, LinkOption.NOFOLLOW_LINKS)) {
      current = current.getParent();
    }
    if (current == null) {
      throw new IllegalArgumentException("no existing ancestor for " + start);
    }
    return current;
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
