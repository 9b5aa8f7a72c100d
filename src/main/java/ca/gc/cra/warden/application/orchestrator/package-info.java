/**
 * <strong>Purpose:</strong> Incident management over the leaf security subsystems: event to incident mapping,
 * response policy and execution, the emergency protocol, posture assessment and the secure access gate.
 * <p><strong>Concurrency:</strong> Events are drained on the security loop; gate denials create incidents on the
 * calling thread. Response actions that touch a project serialize on its project lock.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.application.orchestrator;
