package ca.gc.cra.tint.application.port;

/**
 * <strong>What:</strong> Port abstracting encoder metrics emission.
 * <p><strong>Why:</strong> Lets the pool and renderer record reuse and write outcomes without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Output port implemented by adapters such as {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Expose counter increments for events like buffer reuse or short writes.</li>
 *   <li>Record numeric observations such as rendered line sizes.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent updates; the shared pool reports
 * from every logging thread.</p>
 * <p><strong>Performance:</strong> Calls sit on the logging hot path and should be non-blocking O(1).</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code tint.pool.reused}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key metric identifier using dotted naming (e.g., {@code tint.entry.shortWrite}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key metric identifier using dotted naming; must not be {@code null}
   * @param value observed value (e.g., bytes); semantics defined by the caller
   */
  void observe(String key, long value);

  /**
   * Metrics implementation that ignores all updates.
   */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
