/**
 * Metrics adapters bridging the {@code MetricsPort} to OpenTelemetry.
 * <p><strong>Role:</strong> Adapter layer on the observability plane.</p>
 * <p><strong>Concurrency:</strong> Instrument caches are concurrent maps; safe for every logging thread.</p>
 * <p><strong>Metrics:</strong> Publishes {@code tint.pool.*} and {@code tint.entry.*}.</p>
 * <p><strong>Security:</strong> Only counts and sizes are exported, never field values.</p>
 */
package ca.gc.cra.tint.infrastructure.metrics;
