package ca.gc.cra.tint.infrastructure.sink;

import ca.gc.cra.tint.application.port.Sink;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * {@link Sink} keeping a copy of the last line written, for hosts that need the rendered bytes back.
 * <p>Not thread-safe; use one instance per entry.
 */
public final class ByteArraySink implements Sink {
  private static final byte[] EMPTY = new byte[0];

  private byte[] bytes = EMPTY;

  @Override
  public int write(byte[] source, int offset, int length) {
    Objects.checkFromIndexSize(offset, length, source.length);
    bytes = Arrays.copyOfRange(source, offset, offset + length);
    return length;
  }

  /**
   * Returns the bytes of the last write, or an empty array before the first one.
   */
  public byte[] toByteArray() {
    return bytes;
  }

  /**
   * Decodes the last write as UTF-8.
   */
  @Override
  public String toString() {
    return new String(bytes, StandardCharsets.UTF_8);
  }
}
