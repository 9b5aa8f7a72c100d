/**
 * Filesystem storage for forensic snapshots, evidence bundles and project backups.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.evidence;
