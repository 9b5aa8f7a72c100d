/**
 * <strong>Purpose:</strong> Logging utilities that tune verbosity, capture recent output and sanitize
 * attacker-controlled text before emission.
 * <p><strong>Concurrency:</strong> Helpers are stateless; {@link ca.gc.cra.warden.logging.RecentLogBuffer}
 * guards its ring with its own monitor.</p>
 * <p><strong>Security:</strong> Attacker-supplied paths are truncated before they reach a log line.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.logging;
