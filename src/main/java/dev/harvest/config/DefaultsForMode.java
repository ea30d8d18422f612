package dev.harvest.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Flat default key-value settings per CLI command.
 * <p>Defaults form the lowest precedence layer; YAML and CLI arguments override them.</p>
 *
 * @since 0.1.0
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns the defaults for a command.
   *
   * @param mode {@code build}, {@code history} or {@code cache}
   * @return immutable defaults including the common settings
   * @throws IllegalArgumentException for unknown modes
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "build" -> buildBuildDefaults();
      case "history" -> buildHistoryDefaults();
      case "cache" -> buildCacheDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    BuildConfig defaults = BuildConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("dataDir", defaults.dataDir().toString());
    map.put("cacheDir", defaults.cacheDir().toString());
    map.put("metricsExporter", "otlp");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    map.put("verbose", "false");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildBuildDefaults() {
    BuildConfig defaults = BuildConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("exportDir", defaults.exportDir().toString());
    map.put("workers", Integer.toString(defaults.workers()));
    map.put("timeout", "0");
    map.put("force", "");
    map.put("forceAll", "false");
    map.put("dryRun", "false");
    map.put("cacheTtl", Long.toString(defaults.cacheTtl().toSeconds()));
    map.put("clearCache", "");
    map.put("historyRetention", Integer.toString(defaults.historyRetention()));
    map.put("userAgent", defaults.userAgent());
    map.put("requestTimeout", Long.toString(defaults.requestTimeout().toSeconds()));
    return map;
  }

  private static Map<String, String> buildHistoryDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("stage", "");
    map.put("limit", "20");
    return map;
  }

  private static Map<String, String> buildCacheDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("tag", "");
    return map;
  }
}
