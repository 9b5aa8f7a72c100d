/**
 * <strong>Purpose:</strong> Per-project zero-trust isolation: the level catalog, verification checks, the
 * per-access gate and threat scanning over recorded activity.
 * <p><strong>Concurrency:</strong> Periodic checks and threat scans run on the security loop; the gate runs on
 * caller threads. Quarantine and configuration backups serialize on the project lock.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.isolation;
