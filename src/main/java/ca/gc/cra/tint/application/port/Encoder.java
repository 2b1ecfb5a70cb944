package ca.gc.cra.tint.application.port;

import ca.gc.cra.tint.domain.Level;
import java.io.IOException;
import java.time.Instant;

/**
 * <strong>What:</strong> Field encoder that also renders complete entries and owns pooled memory.
 * <p><strong>Why:</strong> Host frameworks keep one encoder per logger context, clone it to add per-call fields,
 * and render the result into a sink.</p>
 * <p><strong>Role:</strong> Primary port implemented by {@code ColorTextEncoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Produce independent copies carrying the accumulated fields.</li>
 *   <li>Render level, time, message, and fields into one line and verify the sink accepted all of it.</li>
 *   <li>Return borrowed buffers to their pool on {@link #close()}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe. Use {@link #copy()} to hand fields to another thread.</p>
 *
 * @since 0.1.0
 */
public interface Encoder extends FieldEncoder, AutoCloseable {
  /**
   * Creates an independent encoder holding the same fields and configuration.
   *
   * @return new encoder; the caller must close it
   */
  Encoder copy();

  /**
   * Renders one entry and writes it to {@code sink} with a single call.
   *
   * @param sink destination; must not be {@code null}
   * @param message entry message; empty omits the message segment
   * @param level entry severity
   * @param time entry timestamp
   * @throws NullPointerException if {@code sink} is {@code null}
   * @throws IOException if the sink fails or accepts fewer bytes than the rendered line
   */
  void writeEntry(Sink sink, String message, Level level, Instant time) throws IOException;

  /**
   * Returns this encoder's buffer to its pool. The encoder must not be used afterwards.
   */
  @Override
  void close();
}
