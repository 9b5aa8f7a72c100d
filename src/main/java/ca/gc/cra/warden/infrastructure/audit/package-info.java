/**
 * File-backed audit trail for security incidents.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.audit;
