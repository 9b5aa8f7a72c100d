package ca.gc.cra.warden.application.boundary;

import ca.gc.cra.warden.domain.boundary.FileOperation;
import ca.gc.cra.warden.domain.path.AccessOperation;
import java.nio.file.Path;
import java.util.Objects;

/**
 * Facts about one access that boundary rules are evaluated against.
 *
 * @param sourcePath root of the project the access originates from; {@code null} outside any project
 * @param targetPath normalized absolute target
 * @param accessOperation coarse operation
 * @param fileOperation classified file operation
 * @param activeProject project the access originates from; {@code null} outside any project
 * @param targetOwner project owning the target; {@code null} outside project sandboxes
 * @param executable whether the target is an executable
 * @param traversal whether the raw target carried a {@code ..} segment
 * @param symlinkEscape whether the target is a symbolic link resolving outside its boundary
 * @since 0.1.0
 */
public record RuleContext(
    Path sourcePath,
    Path targetPath,
    AccessOperation accessOperation,
    FileOperation fileOperation,
    String activeProject,
    String targetOwner,
    boolean executable,
    boolean traversal,
    boolean symlinkEscape) {

  public RuleContext {
    Objects.requireNonNull(targetPath, "targetPath");
    Objects.requireNonNull(accessOperation, "accessOperation");
    Objects.requireNonNull(fileOperation, "fileOperation");
  }

  boolean createsContent() {
    return fileOperation == FileOperation.CREATE
        || fileOperation == FileOperation.MODIFY
        || fileOperation == FileOperation.EXECUTABLE_CREATION;
  }
}
