package ca.gc.cra.warden.infrastructure.evidence;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.testing.MutableClock;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileEvidenceStoreTest {

  @TempDir Path tempDir;

  private final MutableClock clock = new MutableClock();
  private FileEvidenceStore store;

  @BeforeEach
  void setUp() {
    store = new FileEvidenceStore(
        tempDir.resolve("forensics"), tempDir.resolve("evidence"), tempDir.resolve("backups"), clock);
  }

  @Test
  void evidenceBundlesAreWrittenOnce() throws IOException {
    assertFalse(store.hasEvidenceBundle("INC-1"));

    Path first = store.writeEvidenceBundle("INC-1", Map.of("attempt", "first"));
    Path second = store.writeEvidenceBundle("INC-1", Map.of("attempt", "second"));

    assertEquals(first, second);
    assertTrue(store.hasEvidenceBundle("INC-1"));
    assertEquals("first",
        JsonDocuments.parseObject(Files.readString(first, StandardCharsets.UTF_8)).get("attempt"));
  }

  @Test
  void forensicSnapshotsUseSanitizedNames() throws IOException {
    Path written = store.writeForensicSnapshot("../INC 1", Map.of("incident", "x"));

    assertEquals(tempDir.resolve("forensics").resolve(".._INC_1.json"), written);
    assertTrue(Files.exists(written));
  }

  @Test
  void projectBackupsCopyTheTree() throws IOException {
    Path root = tempDir.resolve("sandbox/proj1");
    Files.createDirectories(root.resolve("src"));
    Files.writeString(root.resolve("src/main.py"), "print('hi')", StandardCharsets.UTF_8);

    Path backup = store.backupProject("proj1", root);

    assertEquals(tempDir.resolve("backups/proj1").resolve(Long.toString(clock.nowMillis())), backup);
    assertEquals("print('hi')", Files.readString(backup.resolve("src/main.py"), StandardCharsets.UTF_8));
  }

  @Test
  void backingUpAMissingProjectFails() {
    assertThrows(IOException.class, () -> store.backupProject("proj1", tempDir.resolve("missing")));
  }

  @Test
  void singleFileBackupsAreTimestamped() throws IOException {
    Path config = tempDir.resolve(".warden-project.json");
    Files.writeString(config, "{}", StandardCharsets.UTF_8);

    Path copy = store.backupFile("proj1", config);

    assertEquals(tempDir.resolve("backups/proj1/files").resolve(clock.nowMillis() + "-.warden-project.json"), copy);
    assertEquals("{}", Files.readString(copy, StandardCharsets.UTF_8));
  }

  @Test
  void sanitizeReplacesUnsafeCharacters() {
    assertEquals("a_b_c", FileEvidenceStore.sanitize("a/b\\c"));
    assertEquals("x", FileEvidenceStore.sanitize(".."));
    assertEquals("x", FileEvidenceStore.sanitize(""));
  }
}
