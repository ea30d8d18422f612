package dev.harvest.infrastructure.metrics;

import dev.harvest.application.port.MetricsPort;
import io.opentelemetry.api.common.AttributeKey;
import io.opentelemetry.api.common.Attributes;
import io.opentelemetry.api.metrics.LongCounter;
import io.opentelemetry.api.metrics.LongHistogram;
import io.opentelemetry.api.metrics.Meter;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * <strong>What:</strong> {@link MetricsPort} backed by OpenTelemetry counters and histograms.
 * <p>Instruments are created lazily per metric key and cached. Each data point carries the original
 * key under {@code harvest.metric.key} so that sanitized instrument names stay traceable. Keys ending
 * in {@code .ms} are recorded with unit {@code ms}.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use by stage workers.</p>
 *
 * @since 0.1.0
 */
public final class OpenTelemetryMetricsAdapter implements MetricsPort, AutoCloseable {
  private static final AttributeKey<String> METRIC_KEY = AttributeKey.stringKey("harvest.metric.key");
  private static final String FALLBACK_NAME = "harvest.metric";

  private final OpenTelemetryBootstrap.BootstrapResult bootstrap;
  private final Meter meter;
  private final ConcurrentMap<String, LongCounter> counters = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, LongHistogram> histograms = new ConcurrentHashMap<>();
  private final ConcurrentMap<String, Attributes> attributes = new ConcurrentHashMap<>();

  /** Creates an adapter configured from system properties and {@code OTEL_*} variables. */
  public OpenTelemetryMetricsAdapter() {
    this(OpenTelemetryBootstrap.initialize());
  }

  OpenTelemetryMetricsAdapter(OpenTelemetryBootstrap.BootstrapResult bootstrap) {
    this.bootstrap = Objects.requireNonNull(bootstrap, "bootstrap");
    this.meter = bootstrap.meter();
  }

  /** Whether metrics are discarded because export is disabled or failed to start. */
  public boolean isNoop() {
    return bootstrap.isNoop();
  }

  @Override
  public void increment(String key) {
    Objects.requireNonNull(key, "key");
    counters.computeIfAbsent(key, this::newCounter).add(1, attributesFor(key));
  }

  @Override
  public void observe(String key, long value) {
    Objects.requireNonNull(key, "key");
    histograms.computeIfAbsent(key, this::newHistogram).record(value, attributesFor(key));
  }

  /** Pushes buffered points to the exporter. */
  public void forceFlush() {
    bootstrap.forceFlush();
  }

  @Override
  public void close() {
    bootstrap.close();
  }

  private LongCounter newCounter(String key) {
    return meter.counterBuilder(instrumentName(key))
        .setUnit("1")
        .setDescription("harvest counter " + key)
        .build();
  }

  private LongHistogram newHistogram(String key) {
    return meter.histogramBuilder(instrumentName(key))
        .ofLongs()
        .setUnit(key.endsWith(".ms") ? "ms" : "1")
        .setDescription("harvest observation " + key)
        .build();
  }

  private Attributes attributesFor(String key) {
    return attributes.computeIfAbsent(key, k -> Attributes.of(METRIC_KEY, k));
  }

  static String instrumentName(String key) {
    String trimmed = key.trim().toLowerCase(Locale.ROOT);
    if (trimmed.isEmpty()) {
      return FALLBACK_NAME;
    }
    StringBuilder name = new StringBuilder(trimmed.length() + 1);
    if (!Character.isLetter(trimmed.charAt(0))) {
      name.append('m');
    }
    for (char c : trimmed.toCharArray()) {
      name.append(Character.isLetterOrDigit(c) || c == '_' || c == '-' || c == '.' ? c : '_');
    }
    return name.toString();
  }
}
