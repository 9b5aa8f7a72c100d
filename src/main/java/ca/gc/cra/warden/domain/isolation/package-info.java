/**
 * Zero-trust isolation model: per-project isolation boundaries, verification checks, threat detection rules
 * and recorded project activity.
 */
package ca.gc.cra.warden.domain.isolation;
