package ca.gc.cra.tint.infrastructure.encoder;

import ca.gc.cra.tint.application.port.Encoder;
import ca.gc.cra.tint.application.port.LogMarshaler;
import ca.gc.cra.tint.application.port.MarshalException;
import ca.gc.cra.tint.application.port.Sink;
import ca.gc.cra.tint.domain.Level;
import ca.gc.cra.tint.infrastructure.buffer.GrowableBuffer;
import java.io.IOException;
import java.math.BigDecimal;
import java.math.MathContext;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;
import java.util.Objects;

/**
 * <strong>What:</strong> Line-oriented text encoder whose output targets humans reading a terminal.
 * <p><strong>Why:</strong> Keys are painted in a stable per-key color and levels in a fixed color so that fields
 * are easy to pick out of a busy console.</p>
 * <p><strong>Role:</strong> Infrastructure implementation of {@link Encoder}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Accumulate fields as {@code key=value} pairs in a pooled buffer.</li>
 *   <li>Render {@code [LEVL] time message fields\n} and verify the sink accepted every byte.</li>
 *   <li>Return both the field buffer and the line buffer to the pool.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Not thread-safe; confine each instance to one log call.</p>
 * <p><strong>Performance:</strong> Steady state allocates only for number and key formatting; buffers are recycled.</p>
 * <p><strong>Observability:</strong> Emits {@code tint.entry.written}, {@code tint.entry.bytes}, and
 * {@code tint.entry.shortWrite} through the configured metrics port.</p>
 *
 * <p>Sample line (escape sequences elided):
 * <pre>{@code [INFO] 2024-01-01T00:00:00Z login                     user=alice attempts=3}</pre>
 *
 * @since 0.1.0
 */
public final class ColorTextEncoder implements Encoder {
  /** RFC 3339 internet date-time without fractional seconds, used when no time format is configured. */
  public static final String DEFAULT_TIME_FORMAT = "yyyy-MM-dd'T'HH:mm:ssXXX";

  private static final int MESSAGE_WIDTH = 25;
  // Digits that always round-trip a binary64 / binary32 value.
  private static final int MAX_DOUBLE_DIGITS = 17;
  private static final int MAX_FLOAT_DIGITS = 9;

  private final EncoderSettings settings;
  private GrowableBuffer buffer;
  private boolean firstNested;

  private ColorTextEncoder(EncoderSettings settings) {
    this.settings = settings;
    this.buffer = settings.pool().acquire();
  }

  /**
   * Creates an encoder with RFC 3339 timestamps in the system zone, adjusted by {@code options}.
   *
   * @param options options applied in order
   * @return new encoder; the caller must {@link #close()} it
   * @throws IllegalArgumentException if the configured time pattern is invalid
   */
  public static ColorTextEncoder create(TextOption... options) {
    return create(List.of(options));
  }

  /**
   * Creates an encoder with RFC 3339 timestamps in the system zone, adjusted by {@code options}.
   *
   * @param options options applied in order; must not be {@code null}
   * @return new encoder; the caller must {@link #close()} it
   * @throws IllegalArgumentException if the configured time pattern is invalid
   */
  public static ColorTextEncoder create(List<TextOption> options) {
    Objects.requireNonNull(options, "options");
    EncoderSettings.Builder builder = EncoderSettings.builder();
    for (TextOption option : options) {
      option.apply(builder);
    }
    return new ColorTextEncoder(builder.build());
  }

  /**
   * Returns the configured time pattern; empty when timestamps are omitted.
   */
  public String timeFormat() {
    return settings.timePattern();
  }

  @Override
  public void addString(String key, String value) {
    addKey(key);
    buffer.writeUtf8(String.valueOf(value));
  }

  @Override
  public void addBoolean(String key, boolean value) {
    addKey(key);
    buffer.writeUtf8(value ? "true" : "false");
  }

  @Override
  public void addInt(String key, int value) {
    addLong(key, value);
  }

  @Override
  public void addLong(String key, long value) {
    addKey(key);
    buffer.writeUtf8(Long.toString(value));
  }

  @Override
  public void addUnsignedInt(String key, int value) {
    addLong(key, Integer.toUnsignedLong(value));
  }

  @Override
  public void addUnsignedLong(String key, long value) {
    addKey(key);
    buffer.writeUtf8(Long.toUnsignedString(value));
  }

  @Override
  public void addUintptr(String key, long value) {
    addKey(key);
    buffer.writeAscii('0');
    buffer.writeAscii('x');
    buffer.writeUtf8(Long.toHexString(value));
  }

  @Override
  public void addFloat(String key, float value) {
    addKey(key);
    buffer.writeUtf8(formatFloat(value));
  }

  @Override
  public void addDouble(String key, double value) {
    addKey(key);
    buffer.writeUtf8(formatDouble(value));
  }

  @Override
  public void addMarshaler(String key, LogMarshaler marshaler) throws MarshalException {
    Objects.requireNonNull(marshaler, "marshaler");
    addKey(key);
    firstNested = true;
    buffer.writeAscii('{');
    try {
      marshaler.marshalLog(this);
    } finally {
      fields().writeAscii('}');
      firstNested = false;
    }
  }

  @Override
  public void addObject(String key, Object value) {
    addString(key, String.valueOf(value));
  }

  @Override
  public ColorTextEncoder copy() {
    GrowableBuffer source = fields();
    ColorTextEncoder clone = new ColorTextEncoder(settings);
    clone.buffer.write(source);
    clone.firstNested = firstNested;
    return clone;
  }

  @Override
  public void writeEntry(Sink sink, String message, Level level, Instant time) throws IOException {
    Objects.requireNonNull(sink, "sink");
    Objects.requireNonNull(level, "level");
    GrowableBuffer fields = fields();
    GrowableBuffer line = settings.pool().acquire();
    try {
      AnsiPalette.appendLevel(line, level);
      appendTime(line, time);
      appendMessage(line, message);
      if (!fields.isEmpty()) {
        line.writeAscii(' ');
        line.write(fields);
      }
      line.writeAscii('\n');

      int expected = line.readableBytes();
      int written = sink.write(line.array(), 0, expected);
      if (written != expected) {
        settings.metrics().increment("tint.entry.shortWrite");
        throw new ShortWriteException(expected, written);
      }
      settings.metrics().increment("tint.entry.written");
      settings.metrics().observe("tint.entry.bytes", expected);
    } finally {
      settings.pool().release(line);
    }
  }

  @Override
  public void close() {
    if (buffer == null) {
      return;
    }
    settings.pool().release(buffer);
    buffer = null;
  }

  /**
   * Exposes the accumulated fields for same-package inspection.
   */
  GrowableBuffer fields() {
    if (buffer == null) {
      throw new IllegalStateException("encoder already closed");
    }
    return buffer;
  }

  boolean firstNested() {
    return firstNested;
  }

  private void addKey(String key) {
    GrowableBuffer out = fields();
    if (!out.isEmpty() && !firstNested) {
      out.writeAscii(' ');
    } else {
      firstNested = false;
    }
    AnsiPalette.appendKey(out, String.valueOf(key));
    out.writeAscii('=');
  }

  private void appendTime(GrowableBuffer line, Instant time) {
    if (settings.formatter() == null) {
      return;
    }
    Objects.requireNonNull(time, "time");
    line.writeAscii(' ');
    line.writeUtf8(settings.formatter().format(time.atZone(settings.zone())));
  }

  private static void appendMessage(GrowableBuffer line, String message) {
    if (message == null || message.isEmpty()) {
      return;
    }
    line.writeAscii(' ');
    line.writeUtf8(message);
    int width = message.codePointCount(0, message.length());
    for (int i = width; i < MESSAGE_WIDTH; i++) {
      line.writeAscii(' ');
    }
  }

  static String formatDouble(double value) {
    if (Double.isNaN(value) || Double.isInfinite(value)) {
      return Double.toString(value);
    }
    if (value == 0d) {
      return Double.doubleToRawLongBits(value) < 0 ? "-0" : "0";
    }
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < MAX_DOUBLE_DIGITS; precision++) {
      BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (candidate.doubleValue() == value) {
        return plain(candidate);
      }
    }
    return plain(exact.round(new MathContext(MAX_DOUBLE_DIGITS, RoundingMode.HALF_EVEN)));
  }

  static String formatFloat(float value) {
    if (Float.isNaN(value) || Float.isInfinite(value)) {
      return Float.toString(value);
    }
    if (value == 0f) {
      return Float.floatToRawIntBits(value) < 0 ? "-0" : "0";
    }
    BigDecimal exact = new BigDecimal(value);
    for (int precision = 1; precision < MAX_FLOAT_DIGITS; precision++) {
      BigDecimal candidate = exact.round(new MathContext(precision, RoundingMode.HALF_EVEN));
      if (candidate.floatValue() == value) {
        return plain(candidate);
      }
    }
    return plain(exact.round(new MathContext(MAX_FLOAT_DIGITS, RoundingMode.HALF_EVEN)));
  }

  private static String plain(BigDecimal value) {
    return value.stripTrailingZeros().toPlainString();
  }
}
