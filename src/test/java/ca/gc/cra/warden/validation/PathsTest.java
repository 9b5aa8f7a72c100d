package ca.gc.cra.warden.validation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class PathsTest {

  @TempDir Path tempDir;

  @Test
  void validateWritableDirReturnsCanonicalPathWhenDirectoryExists() throws IOException {
    Path dir = Files.createDirectory(tempDir.resolve("existing"));
    Path validated = Paths.validateWritableDir(dir, null, false);
    assertEquals(dir.toRealPath(), validated);
  }

  @Test
  void validateWritableDirCreatesWhenRequested() {
    Path dir = tempDir.resolve("missing/child");
    Path validated = Paths.validateWritableDir(dir, null, true);
    assertTrue(Files.isDirectory(validated));
  }

  @Test
  void validateWritableDirRejectsMissingDirectoryWithoutCreation() {
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(tempDir.resolve("absent"), null, false));
  }

  @Test
  void validateWritableDirRejectsFiles() throws IOException {
    Path file = Files.createFile(tempDir.resolve("file.txt"));
    assertThrows(IllegalArgumentException.class, () -> Paths.validateWritableDir(file, null, false));
  }

  @Test
  void validateWritableDirConfinesToBase() {
    Path base = tempDir.resolve("base");
    assertThrows(IllegalArgumentException.class,
        () -> Paths.validateWritableDir(base.resolve("../outside"), base, true));
  }

  @Test
  void cleanPathTextRejectsNulAndControlCharacters() {
    assertEquals("a/b", Paths.requireCleanPathText("path", "a/b"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireCleanPathText("path", "a\0b"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireCleanPathText("path", "a\nb"));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireCleanPathText("path", null));
  }

  @Test
  void requireOutsideRejectsNestedPaths() {
    Path home = tempDir.resolve("home");

    assertEquals(tempDir.resolve("sandbox").toAbsolutePath().normalize(),
        Paths.requireOutside(tempDir.resolve("sandbox"), List.of(home)));
    assertThrows(IllegalArgumentException.class,
        () -> Paths.requireOutside(home.resolve("projects"), List.of(home)));
    assertThrows(IllegalArgumentException.class, () -> Paths.requireOutside(home, List.of(home)));
  }
}
