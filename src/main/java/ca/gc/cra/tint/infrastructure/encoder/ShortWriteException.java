package ca.gc.cra.tint.infrastructure.encoder;

import java.io.IOException;

/**
 * Signals that a sink accepted fewer bytes than the rendered line, so the line may be truncated downstream.
 *
 * @since 0.1.0
 */
public final class ShortWriteException extends IOException {
  private final int expected;
  private final int written;

  /**
   * Creates an exception describing the byte counts of the failed write.
   *
   * @param expected length of the rendered line
   * @param written count reported by the sink
   */
  public ShortWriteException(int expected, int written) {
    super("incomplete write: only wrote " + written + " of " + expected + " bytes");
    this.expected = expected;
    this.written = written;
  }

  /**
   * Returns the length of the rendered line.
   */
  public int expected() {
    return expected;
  }

  /**
   * Returns the count the sink reported.
   */
  public int written() {
    return written;
  }
}
