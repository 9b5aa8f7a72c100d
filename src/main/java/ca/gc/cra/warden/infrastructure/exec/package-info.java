/**
 * Executor factories for the security loop.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.infrastructure.exec;
