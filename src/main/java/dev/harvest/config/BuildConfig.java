package dev.harvest.config;

import dev.harvest.application.pipeline.AbortSignal;
import dev.harvest.application.pipeline.BuildOptions;
import dev.harvest.validation.Numbers;
import dev.harvest.validation.Strings;
import java.net.URI;
import java.net.URISyntaxException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Validated settings for {@code harvest build}.
 * <p><strong>Why:</strong> Converts the merged CLI/YAML/default key-value map into typed values once,
 * so the composition root and the scheduler never see raw strings.</p>
 * <p><strong>Thread-safety:</strong> Immutable record.</p>
 *
 * @param dataDir content store and run history directory
 * @param cacheDir fetch cache directory
 * @param exportDir directory receiving published site data
 * @param workers maximum number of concurrently running stages
 * @param timeout optional whole-build timeout
 * @param forceStages stages forced to run
 * @param forceAll whether every stage is forced
 * @param dryRun whether to print the plan without running stages
 * @param cacheTtl time-to-live of freshly fetched cache entries
 * @param clearCacheTags cache tags evicted before the build
 * @param historyRetention runs kept per stage when the history is compacted; {@code 0} keeps all
 * @param feeds feed name to URL, sorted by name
 * @param userAgent HTTP {@code User-Agent} for feed requests
 * @param requestTimeout per-request HTTP timeout
 * @since 0.1.0
 */
public record BuildConfig(
    Path dataDir,
    Path cacheDir,
    Path exportDir,
    int workers,
    Optional<Duration> timeout,
    Set<String> forceStages,
    boolean forceAll,
    boolean dryRun,
    Duration cacheTtl,
    Set<String> clearCacheTags,
    int historyRetention,
    Map<String, String> feeds,
    String userAgent,
    Duration requestTimeout) {

  static final int MAX_WORKERS = 64;
  static final String FEED_PREFIX = "feeds.";
  private static final Path DEFAULT_BASE = defaultBaseDirectory();

  public BuildConfig {
    dataDir = Objects.requireNonNull(dataDir, "dataDir").toAbsolutePath().normalize();
    cacheDir = Objects.requireNonNull(cacheDir, "cacheDir").toAbsolutePath().normalize();
    exportDir = Objects.requireNonNull(exportDir, "exportDir").toAbsolutePath().normalize();
    Numbers.requireRange("workers", workers, 1, MAX_WORKERS);
    timeout = Objects.requireNonNullElse(timeout, Optional.empty());
    forceStages = Set.copyOf(Objects.requireNonNullElse(forceStages, Set.of()));
    clearCacheTags = Set.copyOf(Objects.requireNonNullElse(clearCacheTags, Set.of()));
    requirePositive("cacheTtl", cacheTtl);
    Numbers.requireRange("historyRetention", historyRetention, 0, Integer.MAX_VALUE);
    feeds = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNullElse(feeds, Map.of())));
    userAgent = Strings.requirePrintableAscii("userAgent", userAgent, 256);
    requirePositive("requestTimeout", requestTimeout);
    if (dryRun && !clearCacheTags.isEmpty()) {
      throw new IllegalArgumentException("clearCache cannot be combined with dryRun");
    }
  }

  /** Settings used when nothing is configured. */
  public static BuildConfig defaults() {
    return new BuildConfig(
        DEFAULT_BASE.resolve("data"),
        DEFAULT_BASE.resolve("cache"),
        DEFAULT_BASE.resolve("site"),
        4,
        Optional.empty(),
        Set.of(),
        false,
        false,
        Duration.ofHours(1),
        Set.of(),
        50,
        Map.of(),
        "harvest/0.1",
        Duration.ofSeconds(30));
  }

  /**
   * Builds a configuration from merged key-value options; missing keys fall back to {@link #defaults()}.
   *
   * @param options effective options
   * @return validated configuration
   * @throws IllegalArgumentException naming the first invalid key
   */
  public static BuildConfig fromMap(Map<String, String> options) {
    Objects.requireNonNull(options, "options");
    BuildConfig defaults = defaults();

    Path dataDir = path(options, "dataDir", defaults.dataDir());
    Path cacheDir = path(options, "cacheDir", defaults.cacheDir());
    Path exportDir = path(options, "exportDir", defaults.exportDir());
    int workers = (int) longValue(options, "workers", defaults.workers(), 1, MAX_WORKERS);
    long timeoutSeconds = longValue(options, "timeout", 0, 0, Duration.ofDays(1).toSeconds());
    Optional<Duration> timeout = timeoutSeconds == 0
        ? Optional.empty()
        : Optional.of(Duration.ofSeconds(timeoutSeconds));
    long ttlSeconds = longValue(options, "cacheTtl", defaults.cacheTtl().toSeconds(), 1, Duration.ofDays(365).toSeconds());
    int retention = (int) longValue(options, "historyRetention", defaults.historyRetention(), 0, 100_000);
    long requestSeconds = longValue(
        options, "requestTimeout", defaults.requestTimeout().toSeconds(), 1, Duration.ofMinutes(10).toSeconds());

    String userAgent = options.get("userAgent");
    if (userAgent == null || userAgent.isBlank()) {
      userAgent = defaults.userAgent();
    }

    return new BuildConfig(
        dataDir,
        cacheDir,
        exportDir,
        workers,
        timeout,
        Strings.tagList("force", options.get("force")),
        bool(options, "forceAll"),
        bool(options, "dryRun"),
        Duration.ofSeconds(ttlSeconds),
        Strings.tagList("clearCache", options.get("clearCache")),
        retention,
        feeds(options),
        userAgent,
        Duration.ofSeconds(requestSeconds));
  }

  /**
   * Scheduler options derived from this configuration.
   *
   * @param abort signal the caller may trigger, e.g. from a shutdown hook
   * @return build options
   */
  public BuildOptions toOptions(AbortSignal abort) {
    BuildOptions.Builder builder = BuildOptions.builder()
        .force(forceStages)
        .forceAll(forceAll)
        .dryRun(dryRun)
        .clearCache(clearCacheTags)
        .abort(abort);
    timeout.ifPresent(builder::timeout);
    return builder.build();
  }

  static Map<String, String> feeds(Map<String, String> options) {
    Map<String, String> feeds = new TreeMap<>();
    for (Map.Entry<String, String> entry : options.entrySet()) {
      String key = entry.getKey();
      if (key == null || !key.startsWith(FEED_PREFIX)) {
        continue;
      }
      String name = Strings.requireTag(key, key.substring(FEED_PREFIX.length()));
      String url = entry.getValue();
      if (url == null || url.isBlank()) {
        continue;
      }
      feeds.put(name, requireFeedUrl(key, url.trim()));
    }
    return feeds;
  }

  private static String requireFeedUrl(String key, String raw) {
    Strings.requirePrintableAscii(key, raw, 2_048);
    try {
      URI uri = new URI(raw);
      String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
      if (!scheme.equals("http") && !scheme.equals("https")) {
        throw new IllegalArgumentException(key + " must use http or https");
      }
      if (uri.getHost() == null || uri.getHost().isBlank()) {
        throw new IllegalArgumentException(key + " must include a host");
      }
      return raw;
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(key + " must be a valid URL", ex);
    }
  }

  private static Path path(Map<String, String> options, String key, Path fallback) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(Strings.requireNonBlank(key, raw));
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(key + " is not a valid path: " + ex.getMessage(), ex);
    }
  }

  private static long longValue(Map<String, String> options, String key, long fallback, long min, long max) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return fallback;
    }
    return Numbers.parseRange(key, raw, min, max);
  }

  private static boolean bool(Map<String, String> options, String key) {
    String raw = options.get(key);
    if (raw == null || raw.isBlank()) {
      return false;
    }
    String normalized = raw.trim().toLowerCase(Locale.ROOT);
    if (!normalized.equals("true") && !normalized.equals("false")) {
      throw new IllegalArgumentException(key + " must be true or false (was '" + raw + "')");
    }
    return Boolean.parseBoolean(normalized);
  }

  private static void requirePositive(String name, Duration value) {
    Objects.requireNonNull(value, name);
    if (value.isNegative() || value.isZero()) {
      throw new IllegalArgumentException(name + " must be positive");
    }
  }

  static Path defaultBaseDirectory() {
    String userHome = System.getProperty("user.home", ".");
    return Path.of(userHome, ".harvest");
  }
}
