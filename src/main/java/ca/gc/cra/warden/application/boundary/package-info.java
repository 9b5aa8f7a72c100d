/**
 * <strong>Purpose:</strong> Rule-based filesystem boundary enforcement: the boundary registry, rule interpreter,
 * integrity hashing and violation remediation.
 * <p><strong>Concurrency:</strong> Registry mutations use concurrent maps; watcher callbacks and integrity checks
 * run on the single security loop.</p>
 * <p><strong>Security:</strong> Deny remediation deletes artifacts; {@link
 * ca.gc.cra.warden.application.boundary.EnforcementMode#DRY_RUN} switches it off without changing detection.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.boundary;
