/**
 * Small application utilities: identifier generation and per-project locking.
 */
package ca.gc.cra.warden.application.util;
