/**
 * <strong>Purpose:</strong> Ports describing the field-collection, rendering, and sink contracts of the encoder.
 * <p><strong>Pipeline role:</strong> Application layer; infrastructure implements these interfaces and host-framework
 * adapters consume them.</p>
 * <p><strong>Concurrency:</strong> Encoders are single-threaded; sinks and metrics ports document their own guarantees.</p>
 * <p><strong>Performance:</strong> Contracts pass primitives and byte ranges to avoid boxing and copies.</p>
 * <p><strong>Observability:</strong> {@link ca.gc.cra.tint.application.port.MetricsPort} carries pool and write counters.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.tint.application.port;
