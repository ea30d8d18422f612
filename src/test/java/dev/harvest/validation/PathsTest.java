package dev.harvest.validation;

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
  void createsMissingDirectoryWhenAsked() {
    Path target = tempDir.resolve("data/nested");

    Path result = Paths.validateWritableDir("dataDir", target, true);

    assertTrue(Files.isDirectory(target));
    assertEquals(target.toAbsolutePath().normalize(), result);
  }

  @Test
  void leavesMissingDirectoryAloneWithoutCreate() {
    Path target = tempDir.resolve("later/data");

    Path result = Paths.validateWritableDir("dataDir", target, false);

    assertFalse(Files.exists(target));
    assertEquals(target.toAbsolutePath().normalize(), result);
  }

  @Test
  void rejectsRegularFile() throws IOException {
    Path file = Files.writeString(tempDir.resolve("file.txt"), "x");

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir("exportDir", file, true));

    assertTrue(ex.getMessage().contains("is not a directory"));
  }

  @Test
  void rejectsNull() {
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir("cacheDir", null, true));
  }
}
