/**
 * Path validation: decoding, attack classification, allowed-root and protected-path checks, and safe-path
 * synthesis.
 * <p><strong>Security:</strong> Inputs are attacker controlled. Validation never throws for malformed input; it
 * returns an unsafe {@link ca.gc.cra.warden.domain.path.SafePath} instead.</p>
 */
package ca.gc.cra.warden.application.path;
