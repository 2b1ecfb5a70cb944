/**
 * Encoder configuration: defaults, YAML loading, and conversion to encoder options.
 * <p><strong>Role:</strong> Bootstrap layer used by host-framework adapters.</p>
 * <p><strong>Concurrency:</strong> Configuration objects are immutable; safe to share.</p>
 * <p><strong>Security:</strong> Values pass through {@code ca.gc.cra.tint.validation} before use.</p>
 */
package ca.gc.cra.tint.config;
