/**
 * In-process channel carrying {@link ca.gc.cra.warden.domain.events.SecurityEvent}s from the leaf subsystems to
 * the orchestrator.
 */
package ca.gc.cra.warden.application.events;
