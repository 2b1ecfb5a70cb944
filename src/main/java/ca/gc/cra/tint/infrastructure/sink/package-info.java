/**
 * Sink adapters handing rendered lines to JDK streams.
 * <p><strong>Role:</strong> Infrastructure implementing the {@code Sink} port.</p>
 * <p><strong>Concurrency:</strong> Sinks serialize writes so each line lands intact.</p>
 */
package ca.gc.cra.tint.infrastructure.sink;
