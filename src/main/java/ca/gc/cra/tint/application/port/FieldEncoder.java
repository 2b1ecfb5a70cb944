package ca.gc.cra.tint.application.port;

/**
 * <strong>What:</strong> Accumulates typed key/value fields for a single log entry.
 * <p><strong>Why:</strong> Callers report fields with their native types so the encoder chooses the text form
 * (decimal, hexadecimal, shortest round-trip float) instead of every call site formatting values.</p>
 * <p><strong>Role:</strong> Field-collection port handed to callers and to {@link LogMarshaler} callbacks.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Append fields in call order, separated by single spaces.</li>
 *   <li>Frame nested objects as {@code key={...}}.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; one encoder belongs to one log call at a time.</p>
 * <p><strong>Performance:</strong> Appends into a pooled buffer; primitives are formatted without boxing.</p>
 *
 * @since 0.1.0
 */
public interface FieldEncoder {
  /**
   * Appends a string field rendered verbatim.
   *
   * @param key field name
   * @param value field value
   */
  void addString(String key, String value);

  /**
   * Appends a boolean field rendered as {@code true} or {@code false}.
   *
   * @param key field name
   * @param value field value
   */
  void addBoolean(String key, boolean value);

  /**
   * Appends a signed 32-bit integer field in decimal.
   *
   * @param key field name
   * @param value field value
   */
  void addInt(String key, int value);

  /**
   * Appends a signed 64-bit integer field in decimal.
   *
   * @param key field name
   * @param value field value
   */
  void addLong(String key, long value);

  /**
   * Appends a field whose bits are interpreted as an unsigned 32-bit integer, in decimal.
   *
   * @param key field name
   * @param value field value, treated as unsigned
   */
  void addUnsignedInt(String key, int value);

  /**
   * Appends a field whose bits are interpreted as an unsigned 64-bit integer, in decimal.
   *
   * @param key field name
   * @param value field value, treated as unsigned
   */
  void addUnsignedLong(String key, long value);

  /**
   * Appends an address-like value as unsigned lower-case hexadecimal with a {@code 0x} prefix.
   *
   * @param key field name
   * @param value field value, treated as unsigned
   */
  void addUintptr(String key, long value);

  /**
   * Appends a 32-bit float in the shortest decimal form that parses back to the same value.
   *
   * @param key field name
   * @param value field value
   */
  void addFloat(String key, float value);

  /**
   * Appends a 64-bit float in the shortest decimal form that parses back to the same value.
   *
   * @param key field name
   * @param value field value
   */
  void addDouble(String key, double value);

  /**
   * Appends a nested object as {@code key={...}}, letting {@code marshaler} report the inner fields.
   *
   * @param key field name
   * @param marshaler object reporting its own fields; must not be {@code null}
   * @throws MarshalException the exception raised by {@code marshaler}, unchanged; the frame is still closed
   */
  void addMarshaler(String key, LogMarshaler marshaler) throws MarshalException;

  /**
   * Appends an arbitrary object using its string form.
   *
   * @param key field name
   * @param value field value; {@code null} renders as {@code null}
   */
  void addObject(String key, Object value);
}
