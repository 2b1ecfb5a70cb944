package ca.gc.cra.tint.infrastructure.encoder;

import ca.gc.cra.tint.application.port.MetricsPort;
import ca.gc.cra.tint.infrastructure.buffer.BufferPool;
import java.time.ZoneId;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Construction-time option for {@link ColorTextEncoder}.
 * <p><strong>Why:</strong> Keeps the encoder factory stable while letting callers override individual settings.</p>
 * <p><strong>Role:</strong> Options are applied in the order given; a later option overrides an earlier one.</p>
 * <p><strong>Thread-safety:</strong> Immutable; options may be shared and reused across encoders.</p>
 *
 * @since 0.1.0
 */
public final class TextOption {
  private final String description;
  private final Consumer<EncoderSettings.Builder> action;

  private TextOption(String description, Consumer<EncoderSettings.Builder> action) {
    this.description = description;
    this.action = action;
  }

  /**
   * Sets the timestamp layout.
   *
   * @param pattern {@link java.time.format.DateTimeFormatter} pattern; empty omits timestamps entirely
   * @return option applying the layout
   */
  public static TextOption timeFormat(String pattern) {
    Objects.requireNonNull(pattern, "pattern");
    return new TextOption("timeFormat(" + pattern + ")", builder -> builder.timePattern = pattern);
  }

  /**
   * Omits timestamps from rendered lines; same as {@code timeFormat("")}.
   *
   * @return option clearing the layout
   */
  public static TextOption noTime() {
    return timeFormat("");
  }

  /**
   * Sets the zone used to render entry instants. Defaults to the system zone.
   *
   * @param zone zone; must not be {@code null}
   * @return option applying the zone
   */
  public static TextOption timeZone(ZoneId zone) {
    Objects.requireNonNull(zone, "zone");
    return new TextOption("timeZone(" + zone + ")", builder -> builder.zone = zone);
  }

  /**
   * Routes {@code tint.entry.*} metrics to {@code metrics}. Defaults to {@link MetricsPort#NO_OP}.
   *
   * @param metrics metrics port; must not be {@code null}
   * @return option applying the port
   */
  public static TextOption metrics(MetricsPort metrics) {
    Objects.requireNonNull(metrics, "metrics");
    return new TextOption("metrics", builder -> builder.metrics = metrics);
  }

  /**
   * Borrows buffers from {@code pool} instead of {@link ca.gc.cra.tint.infrastructure.buffer.BufferPools}.
   *
   * @param pool buffer pool; must not be {@code null}
   * @return option applying the pool
   */
  public static TextOption bufferPool(BufferPool pool) {
    Objects.requireNonNull(pool, "pool");
    return new TextOption("bufferPool", builder -> builder.pool = pool);
  }

  void apply(EncoderSettings.Builder builder) {
    action.accept(builder);
  }

  @Override
  public String toString() {
    return description;
  }
}
