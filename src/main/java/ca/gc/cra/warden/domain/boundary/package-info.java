/**
 * Filesystem boundary model: boundaries, ordered access rules, observed file events and violations.
 * <p><strong>Concurrency:</strong> Records are immutable. {@link ca.gc.cra.warden.domain.boundary.FileSystemBoundary}
 * guards its integrity baseline with its own monitor.</p>
 */
package ca.gc.cra.warden.domain.boundary;
