/**
 * Path validation results and traversal attempt records produced by
 * {@link ca.gc.cra.warden.application.path.PathGuard}.
 * <p><strong>Concurrency:</strong> Records are immutable.</p>
 */
package ca.gc.cra.warden.domain.path;
