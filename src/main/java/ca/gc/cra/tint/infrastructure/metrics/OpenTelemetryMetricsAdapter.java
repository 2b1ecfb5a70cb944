package ca.gc.cra.tint.infrastructure.metrics;

import ca.gc.cra.tint.application.port.MetricsPort;
import ca.gc.cra.tint.infrastructure.buffer.BufferPool;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import io.opentelemetry.api.metrics.ObservableLongGauge;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Metrics adapter that forwards encoder counters and histograms to OpenTelemetry.
 * <p>Instruments are created lazily per key and cached. Names are lower-cased and restricted to
 * {@code [a-z0-9._-]}; the original key travels as the {@code tint.metric.key} attribute.
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(OpenTelemetryMetricsAdapter.class);
  static final AttributeKey<String> METRIC_KEY_ATTRIBUTE = AttributeKey.stringKey("tint.metric.key");
  private static final String FALLBACK_METRIC_NAME = "tint.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, Instrument<LongCounter>> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Instrument<LongHistogram>> histograms = new ConcurrentHashMap<>();
  private final List<ObservableLongGauge> gauges = new ArrayList<>();

  /**
   * Creates an adapter wired to the environment-configured OpenTelemetry exporter.
   */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
    if (bootstrap.isNoop()) {
      log.info("OpenTelemetry metrics adapter running in noop mode");
    }
  }

  @Override
  public void increment(String key) {
    Instrument<LongCounter> instrument = counters.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> new Instrument<>(
            meter.counterBuilder(sanitizeName(k)).setUnit("1").setDescription("TINT counter for " + k).build(),
            Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().add(1, instrument.attributes());
  }

  @Override
  public void observe(String key, long value) {
    Instrument<LongHistogram> instrument = histograms.computeIfAbsent(
        Objects.requireNonNull(key, "key"),
        k -> new Instrument<>(
            meter.histogramBuilder(sanitizeName(k)).ofLongs().setDescription("TINT observation for " + k).build(),
            Attributes.of(METRIC_KEY_ATTRIBUTE, k)));
    instrument.handle().record(value, instrument.attributes());
  }

  /**
   * Publishes {@code tint.pool.idle}, {@code tint.pool.allocated.total}, and {@code tint.pool.reused.total} gauges
   * read from {@code pool} on every collection.
   *
   * @param name value of the {@code tint.pool.name} attribute
   * @param pool pool to observe; must not be {@code null}
   */
  public void registerPoolGauges(String name, BufferPool pool) {
    Objects.requireNonNull(pool, "pool");
    Attributes attributes = Attributes.of(AttributeKey.stringKey("tint.pool.name"), Objects.requireNonNull(name, "name"));
    synchronized (gauges) {
      gauges.add(meter.gaugeBuilder("tint.pool.idle").ofLongs()
          .setDescription("Idle buffers held by the pool")
          .buildWithCallback(m -> m.record(pool.idleCount(), attributes)));
      gauges.add(meter.gaugeBuilder("tint.pool.allocated.total").ofLongs()
          .setDescription("Buffers allocated because the pool was empty")
          .buildWithCallback(m -> m.record(pool.allocatedCount(), attributes)));
      gauges.add(meter.gaugeBuilder("tint.pool.reused.total").ofLongs()
          .setDescription("Acquisitions served from idle buffers")
          .buildWithCallback(m -> m.record(pool.reusedCount(), attributes)));
    }
  }

  void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    synchronized (gauges) {
      for (ObservableLongGauge gauge : gauges) {
        gauge.close();
      }
      gauges.clear();
    }
    bootstrap.close();
  }

  static String sanitizeName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_METRIC_NAME;
    }
    StringBuilder result = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      result.append('m');
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      boolean allowed = Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.';
      result.append(allowed ? c : '_');
    }
    String sanitized = result.toString();
    if (!sanitized.equals(key)) {
      log.debug("Sanitized metric name '{}' -> '{}'", key, sanitized);
    }
    return sanitized;
  }

  private record Instrument<T>(T handle, Attributes attributes) {}
}
