package ca.gc.cra.warden.infrastructure.evidence;

import ca.gc.cra.warden.application.json.JsonDocuments;
import ca.gc.cra.warden.application.port.ClockPort;
import ca.gc.cra.warden.application.port.EvidenceStorePort;
import java.io.IOException;
import java.nio.file.FileVisitResult;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.nio.file.SimpleFileVisitor;
import java.nio.file.StandardCopyOption;
import java.nio.file.attribute.BasicFileAttributes;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Filesystem-backed evidence store.
 * <p><strong>Layout:</strong>
 * <ul>
 *   <li>{@code forensicsDir/{incidentId}.json}: forensic snapshots, replaced on rewrite.</li>
 *   <li>{@code evidenceDir/{incidentId}.json}: evidence bundles, written once.</li>
 *   <li>{@code backupDir/{projectId}/{epochMillis}/}: project tree copies.</li>
 *   <li>{@code backupDir/{projectId}/files/{epochMillis}-{name}}: single file copies.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Evidence bundle creation is synchronized; backups rely on the caller's project
 * lock.</p>
 *
 * @since 0.1.0
 */
public final class FileEvidenceStore implements EvidenceStorePort {
  private static final Logger log = LoggerFactory.getLogger(FileEvidenceStore.class);

  private final Path forensicsDir;
  private final Path evidenceDir;
  private final Path backupDir;
  private final ClockPort clock;

  /**
   * Creates a store over the three directories; they are created on first use.
   *
   * @param forensicsDir forensic snapshot directory
   * @param evidenceDir evidence bundle directory
   * @param backupDir backup directory
   * @param clock time source for backup names
   */
  public FileEvidenceStore(Path forensicsDir, Path evidenceDir, Path backupDir, ClockPort clock) {
    this.forensicsDir = Objects.requireNonNull(forensicsDir, "forensicsDir");
    this.evidenceDir = Objects.requireNonNull(evidenceDir, "evidenceDir");
    this.backupDir = Objects.requireNonNull(backupDir, "backupDir");
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Path writeForensicSnapshot(String incidentId, Map<String, Object> document) throws IOException {
    Files.createDirectories(forensicsDir);
    Path file = forensicsDir.resolve(sanitize(incidentId) + ".json");
    JsonDocuments.writeFile(file, Objects.requireNonNull(document, "document"));
    log.info("Forensic snapshot for {} written to {}", incidentId, file);
    return file;
  }

  @Override
  public synchronized Path writeEvidenceBundle(String incidentId, Map<String, Object> document) throws IOException {
    Path file = evidenceFile(incidentId);
    if (Files.exists(file)) {
      return file;
    }
    Files.createDirectories(evidenceDir);
    JsonDocuments.writeFile(file, Objects.requireNonNull(document, "document"));
    log.info("Evidence for {} preserved at {}", incidentId, file);
    return file;
  }

  @Override
  public synchronized boolean hasEvidenceBundle(String incidentId) {
    return Files.exists(evidenceFile(incidentId));
  }

  @Override
  public Path backupProject(String projectId, Path projectRoot) throws IOException {
    Objects.requireNonNull(projectRoot, "projectRoot");
    if (!Files.isDirectory(projectRoot, LinkOption.NOFOLLOW_LINKS)) {
      throw new IOException("Project root is not a directory: " + projectRoot);
    }
    Path destination = backupDir.resolve(sanitize(projectId)).resolve(Long.toString(clock.nowMillis()));
    Files.createDirectories(destination);
    Files.walkFileTree(projectRoot, new SimpleFileVisitor<>() {
      @Override
      public FileVisitResult preVisitDirectory(Path dir, BasicFileAttributes attrs) throws IOException {
        Files.createDirectories(destination.resolve(projectRoot.relativize(dir).toString()));
        return FileVisitResult.CONTINUE;
      }

      @Override
      public FileVisitResult visitFile(Path file, BasicFileAttributes attrs) throws IOException {
        if (attrs.isRegularFile()) {
          Files.copy(file, destination.resolve(projectRoot.relativize(file).toString()),
              StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.COPY_ATTRIBUTES);
        }
        return FileVisitResult.CONTINUE;
      }
    });
    log.info("Project {} backed up to {}", projectId, destination);
    return destination;
  }

  @Override
  public Path backupFile(String projectId, Path file) throws IOException {
    Objects.requireNonNull(file, "file");
    Path directory = backupDir.resolve(sanitize(projectId)).resolve("files");
    Files.createDirectories(directory);
    Path copy = directory.resolve(clock.nowMillis() + "-" + sanitize(String.valueOf(file.getFileName())));
    Files.copy(file, copy, StandardCopyOption.REPLACE_EXISTING);
    log.debug("Backed up {} for project {} to {}", file, projectId, copy);
    return copy;
  }

  private Path evidenceFile(String incidentId) {
    return evidenceDir.resolve(sanitize(incidentId) + ".json");
  }

  static String sanitize(String id) {
    Objects.requireNonNull(id, "id");
    StringBuilder sb = new StringBuilder(Math.max(16, id.length()));
    for (int i = 0; i < id.length(); i++) {
      char c = id.charAt(i);
      sb.append(Character.isLetterOrDigit(c) || c == '-' || c == '_' || c == '.' ? c : '_');
    }
    String name = sb.toString();
    if (name.isEmpty() || name.chars().allMatch(c -> c == '.')) {
      return "x";
    }
    return name;
  }
}
