/**
 * Ports abstracting time, metrics, the event channel, persistence of audit and evidence records, directory
 * watching and outbound notifications.
 */
package ca.gc.cra.warden.application.port;
