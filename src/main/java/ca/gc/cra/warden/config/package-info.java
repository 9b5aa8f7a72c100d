/**
 * <strong>Purpose:</strong> Configuration loading (defaults, YAML profiles, overrides) and the composition root that
 * wires the security core.
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.config;
