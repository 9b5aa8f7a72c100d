/**
 * Messages exchanged by the security core: the inbound {@link ca.gc.cra.warden.domain.events.SecurityEvent} sum
 * type raised by the subsystems and the outbound {@link ca.gc.cra.warden.domain.events.SecurityNotification}
 * contract consumed by schedulers and dashboards.
 */
package ca.gc.cra.warden.domain.events;
