/**
 * Core domain model for Warden path validation, boundary enforcement, project isolation and incidents.
 * <p><strong>Role:</strong> Domain layer values shared by the four security subsystems without infrastructure
 * dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable unless noted; {@code SecurityIncident} and
 * {@code FileSystemBoundary} carry guarded mutable state.</p>
 * <p><strong>Security:</strong> Path-bearing values may hold attacker-controlled strings; truncate before logging.</p>
 */
package ca.gc.cra.warden.domain;
