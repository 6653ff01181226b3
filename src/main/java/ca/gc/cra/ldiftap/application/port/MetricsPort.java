package ca.gc.cra.ldiftap.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for extraction runs.
 * <p><strong>Why:</strong> Lets the extract use case count files and entries without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter} and {@code NoOpMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must tolerate concurrent updates.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code ldif.entries.emitted}).</p>
 *
 * @implNote Consumers must not pass {@code null} metric keys; adapters may normalize names.
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric identifier (e.g., {@code ldif.files.processed}); must not be {@code null}
   */
  void increment(String key);

  /**
   * Increments the named counter by {@code amount}.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param amount non-negative delta
   */
  default void add(String key, long amount) {
    for (long i = 0; i < amount; i++) {
      increment(key);
    }
  }

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric identifier; must not be {@code null}
   * @param value observed value (e.g., bytes)
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void add(String key, long amount) {}

    @Override public void observe(String key, long value) {}
  };
}
