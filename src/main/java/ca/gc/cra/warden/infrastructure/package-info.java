/**
 * Adapters implementing the application ports: filesystem watching, audit, evidence, notifications, metrics and
 * executors.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure;
