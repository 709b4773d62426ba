package ca.gc.cra.frametap.infrastructure.persistence.io;

import java.io.IOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Staging-file helpers: write under {@code transferring.<name>}, then publish with an atomic rename so
 * readers never observe a partial file.
 *
 * @since 0.1.0
 */
public final class AtomicFiles {
  private static final Logger log = LoggerFactory.getLogger(AtomicFiles.class);

  private AtomicFiles() {}

  /**
   * Returns the staging path for a final target.
   *
   * @param target final path
   * @return sibling path prefixed with {@link TimestampNames#TEMP_PREFIX}
   */
  public static Path tempSibling(Path target) {
    Path name = target.getFileName();
    if (name == null) {
      throw new IllegalArgumentException("target has no file name: " + target);
    }
    return target.resolveSibling(TimestampNames.TEMP_PREFIX + name);
  }

  /**
   * Atomically renames a staging file onto its final name. An existing target is never replaced.
   *
   * @param temp staging file
   * @param target final path
   * @throws IOException if the target exists or the filesystem rejects the move
   */
  public static void publish(Path temp, Path target) throws IOException {
    if (Files.exists(target, LinkOption.NOFOLLOW_LINKS)) {
      throw new FileAlreadyExistsException(target.toString());
    }
    Files.move(temp, target, StandardCopyOption.ATOMIC_MOVE);
  }

  /**
   * Deletes a file if present, logging rather than propagating failures.
   *
   * @param path file to remove; {@code null} is ignored
   * @return {@code true} if a file was removed
   */
  public static boolean deleteQuietly(Path path) {
    if (path == null) {
      return false;
    }
    try {
      return Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.debug("Unable to remove staging file {}", path, ex);
      return false;
    }
  }
}
