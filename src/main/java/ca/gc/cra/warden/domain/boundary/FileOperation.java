package ca.gc.cra.warden.domain.boundary;

import ca.gc.cra.warden.domain.path.AccessOperation;
import java.util.Locale;

/**
 * Filesystem operation classified from an observed change or a requested access.
 *
 * @since 0.1.0
 */
public enum FileOperation {
  READ,
  CREATE,
  MODIFY,
  DELETE,
  EXECUTABLE_CREATION;

  /**
   * Maps the classified operation onto the coarser access vocabulary used by the gates.
   *
   * @return access operation
   */
  public AccessOperation accessOperation() {
    return switch (this) {
      case READ -> AccessOperation.READ;
      case EXECUTABLE_CREATION -> AccessOperation.EXECUTE;
      case CREATE, MODIFY, DELETE -> AccessOperation.WRITE;
    };
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }
}
