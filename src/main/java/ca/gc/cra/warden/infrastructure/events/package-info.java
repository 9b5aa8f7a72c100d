/**
 * Notification adapters: structured logging for production, in-memory capture for tests.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.events;
