package ca.gc.cra.tint.infrastructure.encoder;

import ca.gc.cra.tint.application.port.MetricsPort;
import ca.gc.cra.tint.infrastructure.buffer.BufferPool;
import ca.gc.cra.tint.infrastructure.buffer.BufferPools;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.Objects;

/**
 * Immutable configuration shared by an encoder and all of its copies.
 *
 * @param timePattern {@link DateTimeFormatter} pattern; empty omits timestamps
 * @param formatter compiled {@code timePattern}, or {@code null} when timestamps are omitted
 * @param zone zone used to render entry instants
 * @param pool pool lending field and line buffers
 * @param metrics receives {@code tint.entry.*} metrics
 */
record EncoderSettings(
    String timePattern,
    DateTimeFormatter formatter,
    ZoneId zone,
    BufferPool pool,
    MetricsPort metrics) {

  static Builder builder() {
    return new Builder();
  }

  /**
   * Mutable view handed to {@link TextOption}s while an encoder is being created.
   */
  static final class Builder {
    String timePattern = ColorTextEncoder.DEFAULT_TIME_FORMAT;
    ZoneId zone = ZoneId.systemDefault();
    BufferPool pool = BufferPools.encoderBuffers();
    MetricsPort metrics = MetricsPort.NO_OP;

    private Builder() {}

    EncoderSettings build() {
      Objects.requireNonNull(timePattern, "timePattern");
      DateTimeFormatter formatter = null;
      if (!timePattern.isEmpty()) {
        try {
          formatter = DateTimeFormatter.ofPattern(timePattern, Locale.ROOT);
        } catch (IllegalArgumentException ex) {
          throw new IllegalArgumentException("invalid timeFormat pattern: " + timePattern, ex);
        }
      }
      return new EncoderSettings(
          timePattern,
          formatter,
          Objects.requireNonNull(zone, "zone"),
          Objects.requireNonNull(pool, "pool"),
          Objects.requireNonNull(metrics, "metrics"));
    }
  }
}
