/**
 * <strong>Purpose:</strong> Validation helpers used while loading encoder configuration.
 * <p><strong>Concurrency:</strong> Stateless utilities safe for concurrent invocation.
 * <p><strong>Observability:</strong> No direct metrics or logging; failures surface via {@link IllegalArgumentException}.
 * <p><strong>Security:</strong> Rejects control characters so configuration cannot inject terminal escapes.
 *
 * @since 0.1.0
 */
package ca.gc.cra.tint.validation;
