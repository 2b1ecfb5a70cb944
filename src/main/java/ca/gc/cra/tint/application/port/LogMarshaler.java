package ca.gc.cra.tint.application.port;

/**
 * <strong>What:</strong> Value that knows how to describe itself as log fields.
 * <p><strong>Why:</strong> Structured objects render as a nested {@code key={...}} frame without the encoder
 * knowing their type.</p>
 * <p><strong>Role:</strong> Callback port consumed by {@link FieldEncoder#addMarshaler(String, LogMarshaler)}.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the thread that owns the encoder.</p>
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface LogMarshaler {
  /**
   * Reports this object's fields on {@code encoder}.
   *
   * @param encoder encoder receiving the nested fields; must not be retained
   * @throws MarshalException if the fields cannot be reported; fields added before the failure stay in the frame
   */
  void marshalLog(FieldEncoder encoder) throws MarshalException;
}
