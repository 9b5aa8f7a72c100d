/**
 * Incident and posture model maintained by the security orchestrator.
 * <p><strong>Concurrency:</strong> {@link ca.gc.cra.warden.domain.incident.SecurityIncident} synchronizes its
 * lifecycle state; the remaining types are immutable.</p>
 */
package ca.gc.cra.warden.domain.incident;
