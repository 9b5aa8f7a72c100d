package ca.gc.cra.warden.domain.path;

import java.util.Locale;

/**
 * Kind of access a caller intends to perform on a path.
 *
 * @since 0.1.0
 */
public enum AccessOperation {
  READ,
  WRITE,
  EXECUTE;

  /**
   * Reports whether the operation mutates the filesystem.
   *
   * @return {@code true} for write and execute
   */
  public boolean mutating() {
    return this != READ;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Parses a wire name case-insensitively.
   *
   * @param raw textual operation such as {@code write}
   * @return parsed operation
   * @throws IllegalArgumentException when the value is blank or unknown
   */
  public static AccessOperation fromWireName(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("operation must not be blank");
    }
    return valueOf(raw.trim().toUpperCase(Locale.ROOT));
  }
}
