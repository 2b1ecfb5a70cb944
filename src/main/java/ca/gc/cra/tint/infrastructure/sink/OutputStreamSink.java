package ca.gc.cra.tint.infrastructure.sink;

import ca.gc.cra.tint.application.port.Sink;
import java.io.IOException;
import java.io.OutputStream;
import java.util.Objects;

/**
 * {@link Sink} over a {@link java.io.OutputStream}.
 * <p>{@code OutputStream#write} either writes every byte or throws, so a completed call reports the full length.
 * Writes are serialized on this sink so lines from concurrent encoders never interleave.
 */
public final class OutputStreamSink implements Sink, AutoCloseable {
  private final OutputStream delegate;
  private final boolean flushEachEntry;

  /**
   * Creates a sink that flushes after every entry.
   *
   * @param delegate destination stream; must not be {@code null}
   */
  public OutputStreamSink(OutputStream delegate) {
    this(delegate, true);
  }

  /**
   * Creates a sink over {@code delegate}.
   *
   * @param delegate destination stream; must not be {@code null}
   * @param flushEachEntry whether to flush the stream after each write
   */
  public OutputStreamSink(OutputStream delegate, boolean flushEachEntry) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.flushEachEntry = flushEachEntry;
  }

  @Override
  public synchronized int write(byte[] bytes, int offset, int length) throws IOException {
    Objects.checkFromIndexSize(offset, length, bytes.length);
    delegate.write(bytes, offset, length);
    if (flushEachEntry) {
      delegate.flush();
    }
    return length;
  }

  @Override
  public synchronized void close() throws IOException {
    delegate.close();
  }
}
