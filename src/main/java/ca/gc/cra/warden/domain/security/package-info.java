/**
 * Cross-cutting security vocabulary such as {@link ca.gc.cra.warden.domain.security.Severity}.
 */
package ca.gc.cra.warden.domain.security;
