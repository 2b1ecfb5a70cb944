/**
 * Logback binding for the colored text encoder.
 * <p><strong>Role:</strong> Adapter layer translating {@code ILoggingEvent}s into encoder fields and lines.</p>
 * <p><strong>Concurrency:</strong> Appenders may call {@code encode} concurrently; each call borrows its own encoder.</p>
 * <p><strong>Observability:</strong> Reports failures through Logback status messages, never by throwing.</p>
 */
package ca.gc.cra.tint.adapter.logback;
