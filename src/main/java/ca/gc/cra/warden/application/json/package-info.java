/**
 * JSON reading and writing over Jackson's streaming API, shared by the isolation config files, reports,
 * audit records and evidence bundles.
 */
package ca.gc.cra.warden.application.json;
