package ca.gc.cra.frametap.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableDirReturnsRealPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    assertEquals(dir.toRealPath(), Paths.validateWritableDir("imageDir", dir, false, true));
  }

  @Test
  void validateWritableDirRejectsNonEmptyDirectoryWithoutReuse() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("nonEmpty"));
    Files.createFile(dir.resolve("frame.jpg"));
    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir("imageDir", dir, false, false));
    assertTrue(ex.getMessage().contains("--allow-overwrite"));
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("missing/child");
    Path validated = Paths.validateWritableDir("logDir", dir, true, false);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirLeavesFutureDirectoryAloneDuringDryRun() {
    Path dir = tempDir.resolve("future/child");
    Path validated = Paths.validateWritableDir("logDir", dir, false, false);
    assertEquals(dir.toAbsolutePath().normalize(), validated);
    assertFalse(Files.exists(validated));
  }

  @Test
  void validateWritableDirRejectsRegularFile() throws IOException {
    Path file = Files.createFile(tempDir.resolve("plain.txt"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir("imageDir", file, false, true));
  }
}
