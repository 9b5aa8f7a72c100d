/**
 * <strong>Purpose:</strong> Filesystem adapters: the polling directory watcher used by boundary monitoring.
 * <p><strong>Concurrency:</strong> Watch handles are polled from the security loop and synchronize per handle.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.fs;
