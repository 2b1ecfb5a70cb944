/**
 * Colored text encoder: field accumulation, line rendering, and construction options.
 * <p><strong>Role:</strong> Infrastructure implementing the {@code Encoder} port.</p>
 * <p><strong>Concurrency:</strong> Encoders are single-owner; options and settings are immutable and shareable.</p>
 * <p><strong>Performance:</strong> Field and line buffers come from {@code BufferPools.encoderBuffers()} by default.</p>
 * <p><strong>Metrics:</strong> Emits {@code tint.entry.*} through the configured {@code MetricsPort}.</p>
 */
package ca.gc.cra.tint.infrastructure.encoder;
