/**
 * <strong>Purpose:</strong> Validation helpers used during configuration bootstrap and project creation.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.</p>
 * <p><strong>Observability:</strong> No metrics or logging; failures surface via {@link IllegalArgumentException}.</p>
 * <p><strong>Security:</strong> Rejects control characters and path syntax in identifiers before they reach the
 * filesystem.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.warden.validation;
