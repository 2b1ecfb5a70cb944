package ca.gc.cra.tint.application.port;

import java.io.IOException;

/**
 * <strong>What:</strong> Destination accepting one fully rendered log line per call.
 * <p><strong>Why:</strong> Lets the encoder verify how many bytes the destination accepted and report truncated
 * lines instead of silently emitting partial entries.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OutputStreamSink}.</p>
 * <p><strong>Thread-safety:</strong> Implementations document their own guarantees; the encoder issues one call
 * per entry.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Sink {
  /**
   * Writes {@code length} bytes of {@code bytes} starting at {@code offset}.
   *
   * @param bytes source array; must not be retained after the call returns
   * @param offset first byte to write
   * @param length number of bytes to write
   * @return number of bytes the destination accepted
   * @throws IOException if the destination fails
   */
  int write(byte[] bytes, int offset, int length) throws IOException;
}
