package ca.gc.cra.warden.application.boundary;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.LinkOption;
import java.nio.file.Path;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a SHA-256 content hash over a directory tree.
 *
 * <p>Entries are visited in sorted relative-path order; each contributes its relative path and its contents.
 * Unreadable files contribute their size and modification time instead. Symbolic links contribute their target
 * text and are not followed.</p>
 *
 * @since 0.1.0
 */
public final class DirectoryHasher {
  private static final Logger log = LoggerFactory.getLogger(DirectoryHasher.class);
  private static final int BUFFER_SIZE = 8192;
  /** Hash reported for a missing root. */
  public static final String ABSENT = "absent";

  private DirectoryHasher() {}

  /**
   * Hashes the tree under {@code root}.
   *
   * @param root directory to hash
   * @return lower-case hex digest, or {@link #ABSENT} when the root does not exist
   * @throws IOException when the tree cannot be listed
   */
  public static String hash(Path root) throws IOException {
    if (!Files.exists(root, LinkOption.NOFOLLOW_LINKS)) {
      return ABSENT;
    }
    MessageDigest digest = sha256();
    List<Path> entries;
    try (Stream<Path> walk = Files.walk(root)) {
      entries = walk.filter(path -> !path.equals(root)).sorted().collect(Collectors.toList());
    } catch (UncheckedIOException ex) {
      throw ex.getCause();
    }
    byte[] buffer = new byte[BUFFER_SIZE];
    for (Path entry : entries) {
      digest.update(root.relativize(entry).toString().replace('\\', '/').getBytes(StandardCharsets.UTF_8));
      digest.update((byte) 0);
      if (Files.isSymbolicLink(entry)) {
        digest.update(("link:" + Files.readSymbolicLink(entry)).getBytes(StandardCharsets.UTF_8));
      } else if (Files.isRegularFile(entry, LinkOption.NOFOLLOW_LINKS)) {
        updateWithContent(digest, entry, buffer);
      } else {
        digest.update("dir".getBytes(StandardCharsets.UTF_8));
      }
      digest.update((byte) 0);
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  /**
   * Hashes a single file.
   *
   * @param file file to hash
   * @return lower-case hex digest, or {@link #ABSENT} when the file does not exist
   * @throws IOException when the file cannot be read
   */
  public static String hashFile(Path file) throws IOException {
    if (!Files.exists(file)) {
      return ABSENT;
    }
    MessageDigest digest = sha256();
    try (InputStream in = Files.newInputStream(file)) {
      byte[] buffer = new byte[BUFFER_SIZE];
      int read;
      while ((read = in.read(buffer)) > 0) {
        digest.update(buffer, 0, read);
      }
    }
    return HexFormat.of().formatHex(digest.digest());
  }

  private static void updateWithContent(MessageDigest digest, Path file, byte[] buffer) throws IOException {
    try (InputStream in = Files.newInputStream(file)) {
      int read;
      while ((read = in.read(buffer)) > 0) {
        digest.update(buffer, 0, read);
      }
    } catch (IOException ex) {
      log.debug("Hashing {} by metadata; content unreadable: {}", file, ex.getMessage());
      String metadata = "meta:" + Files.size(file) + ":" + Files.getLastModifiedTime(file).toMillis();
      digest.update(metadata.getBytes(StandardCharsets.UTF_8));
    }
  }

  private static MessageDigest sha256() {
    try {
      return MessageDigest.getInstance("SHA-256");
    } catch (NoSuchAlgorithmException ex) {
      throw new IllegalStateException("SHA-256 unavailable", ex);
    }
  }
}
