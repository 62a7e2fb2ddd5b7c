package ca.gc.cra.rulesync.validation;

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
  void createsMissingDirectoryOnRequest() {
    Path target = tempDir.resolve("a").resolve("b");

    Path validated = Paths.validateWritableDir(target, true);

    assertTrue(Files.isDirectory(validated));
    assertEquals(target.toAbsolutePath().normalize(), validated);
  }

  @Test
  void leavesMissingDirectoryAloneOtherwise() {
    Path target = tempDir.resolve("later");

    Paths.validateWritableDir(target, false);

    assertFalse(Files.exists(target));
  }

  @Test
  void rejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, true));
  }

  @Test
  void resolveChildStaysInsideDirectory() {
    assertEquals(tempDir.resolve("ai.json"), Paths.resolveChild(tempDir, "ai.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveChild(tempDir, "../escape.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveChild(tempDir, "nested/ai.json"));
    assertThrows(IllegalArgumentException.class, () -> Paths.resolveChild(tempDir, "."));
  }
}
