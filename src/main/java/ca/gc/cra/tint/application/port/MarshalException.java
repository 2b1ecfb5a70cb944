package ca.gc.cra.tint.application.port;

/**
 * Checked exception raised by a {@link LogMarshaler} that cannot report its fields.
 *
 * @since 0.1.0
 */
public class MarshalException extends Exception {
  /**
   * Creates an exception with a descriptive message.
   *
   * @param msg human-readable error
   */
  public MarshalException(String msg) { super(msg); }

  /**
   * Creates an exception with a message and underlying cause.
   *
   * @param msg human-readable error
   * @param cause root cause raised while collecting fields
   */
  public MarshalException(String msg, Throwable cause) { super(msg, cause); }
}
