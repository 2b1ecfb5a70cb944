/**
 * Domain values shared by the encoder ports and their host-framework adapters.
 * <p><strong>Role:</strong> Domain layer without infrastructure dependencies.</p>
 * <p><strong>Concurrency:</strong> Types are immutable; safe to share across threads.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tint.domain;
