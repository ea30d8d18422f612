package dev.harvest.application.port;

/**
 * <strong>What:</strong> Port abstracting metrics emission for builds, caches and stores.
 * <p><strong>Why:</strong> Lets the scheduler record counters and timings without binding to a vendor SDK.</p>
 * <p><strong>Role:</strong> Implemented by {@code OpenTelemetryMetricsAdapter}.</p>
 * <p><strong>Thread-safety:</strong> Implementations must accept concurrent updates from stage workers.</p>
 * <p><strong>Observability:</strong> Defines the metric name contract (e.g., {@code build.stage.success},
 * {@code cache.hit}, {@code build.stage.duration.ms}).</p>
 *
 * @since 0.1.0
 */
public interface MetricsPort {
  /**
   * Increments the named counter by one.
   *
   * @param key dotted metric name; must not be {@code null}
   */
  void increment(String key);

  /**
   * Records an observation for a histogram style metric.
   *
   * @param key dotted metric name; must not be {@code null}
   * @param value observed value, in units implied by the name
   */
  void observe(String key, long value);

  /** Metrics implementation that ignores all updates. */
  MetricsPort NO_OP = new MetricsPort() {
    @Override public void increment(String key) {}

    @Override public void observe(String key, long value) {}
  };
}
