package ca.gc.cra.tint.infrastructure.buffer;

/**
 * Central registry for the shared {@link BufferPool} used by encoders.
 * <p>The pool is created on class initialization and needs no configuration. Tests that count reuse should pass
 * their own pool to the encoder, or call {@link BufferPool#clear()} on this one between cases.
 */
public final class BufferPools {
  private static final int ENCODER_BUFFER_BYTES = 4 * 1024;
  private static final int MAX_RETAINED_BYTES = 256 * 1024;
  private static final int MAX_POOL_ENTRIES = Math.max(8, 4 * Runtime.getRuntime().availableProcessors());

  private static final BufferPool ENCODER_POOL =
      new BufferPool(ENCODER_BUFFER_BYTES, MAX_POOL_ENTRIES, MAX_RETAINED_BYTES);

  private BufferPools() {}

  /**
   * Provides the process-wide pool backing field and line buffers.
   */
  public static BufferPool encoderBuffers() {
    return ENCODER_POOL;
  }
}
