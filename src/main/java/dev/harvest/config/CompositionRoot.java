package dev.harvest.config;

import dev.harvest.application.cache.ResilientCache;
import dev.harvest.application.graph.DependencyGraph;
import dev.harvest.application.graph.GraphException;
import dev.harvest.application.pipeline.BuildUseCase;
import dev.harvest.application.port.CachePort;
import dev.harvest.application.port.ClockPort;
import dev.harvest.application.port.ContentStorePort;
import dev.harvest.application.port.MetricsPort;
import dev.harvest.application.port.RunHistoryPort;
import dev.harvest.application.port.StoreException;
import dev.harvest.infrastructure.cache.FileSystemCacheAdapter;
import dev.harvest.infrastructure.exec.ExecutorFactories;
import dev.harvest.infrastructure.history.NdjsonRunHistoryAdapter;
import dev.harvest.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import dev.harvest.infrastructure.stage.feed.FeedClient;
import dev.harvest.infrastructure.stage.feed.HttpFeedClient;
import dev.harvest.infrastructure.store.FileContentStore;
import dev.harvest.infrastructure.time.SystemClockAdapter;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires adapters and use cases for one CLI invocation.
 * <p>Adapters are opened lazily and owned by the root; {@link #close()} releases them in reverse
 * order of acquisition (history, store, metrics).</p>
 * <p><strong>Thread-safety:</strong> Intended for use by the CLI thread only.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  static final String HISTORY_DIR = "history";

  private final BuildConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final AutoCloseable metricsResource;
  private FileContentStore store;
  private NdjsonRunHistoryAdapter history;
  private ResilientCache cache;

  public CompositionRoot(BuildConfig config) {
    this(config, new OpenTelemetryMetricsAdapter(), new SystemClockAdapter());
  }

  /**
   * Creates a root with explicit metrics and clock, e.g. for tests.
   *
   * @param config build configuration
   * @param metrics metrics sink; closed with the root when it is {@link AutoCloseable}
   * @param clock time source
   */
  public CompositionRoot(BuildConfig config, MetricsPort metrics, ClockPort clock) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metricsResource = metrics instanceof AutoCloseable closeable ? closeable : null;
  }

  public BuildConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  public ClockPort clock() {
    return clock;
  }

  /**
   * Opens the content store under {@code dataDir}, acquiring its directory lock.
   *
   * @return store
   * @throws StoreException when the store cannot be opened or is locked by another process
   */
  public synchronized ContentStorePort contentStore() throws StoreException {
    if (store == null) {
      store = FileContentStore.open(config.dataDir(), clock);
    }
    return store;
  }

  /**
   * Opens the run history under {@code dataDir/history}.
   *
   * @return history adapter
   * @throws IOException when the history file cannot be read
   */
  public synchronized RunHistoryPort runHistory() throws IOException {
    if (history == null) {
      history = new NdjsonRunHistoryAdapter(historyDirectory(), config.historyRetention());
    }
    return history;
  }

  /**
   * Returns the fetch cache rooted at {@code cacheDir}, wrapped so failures degrade to misses.
   *
   * @return resilient cache
   * @throws IOException when the cache directory cannot be created
   */
  public synchronized ResilientCache cache() throws IOException {
    if (cache == null) {
      CachePort files = new FileSystemCacheAdapter(config.cacheDir(), clock);
      cache = new ResilientCache(files, metrics);
    }
    return cache;
  }

  public FeedClient feedClient() {
    return new HttpFeedClient(config.requestTimeout(), config.userAgent());
  }

  /**
   * Builds the validated graph of built-in stages.
   *
   * @return sealed graph
   * @throws GraphException when the catalog is inconsistent
   */
  public DependencyGraph stageGraph() throws GraphException {
    return StageCatalog.graphOf(StageCatalog.builtInStages(config, feedClient()));
  }

  /**
   * Assembles the scheduler with file-backed adapters.
   *
   * @return build use case
   * @throws StoreException when the store cannot be opened
   * @throws IOException when the history or cache cannot be opened
   */
  public BuildUseCase buildUseCase() throws StoreException, IOException {
    return new BuildUseCase(
        contentStore(),
        cache(),
        runHistory(),
        clock,
        metrics,
        config.workers(),
        config.cacheTtl(),
        ExecutorFactories.stagePools());
  }

  Path historyDirectory() {
    return historyDirectory(config.dataDir());
  }

  /**
   * Location of the run history for a data directory.
   *
   * @param dataDir data directory
   * @return history directory
   */
  public static Path historyDirectory(Path dataDir) {
    return dataDir.resolve(HISTORY_DIR);
  }

  @Override
  public synchronized void close() {
    if (history != null) {
      try {
        history.close();
      } catch (IOException ex) {
        log.warn("Failed to close run history in {}", historyDirectory(), ex);
      }
      history = null;
    }
    if (store != null) {
      try {
        store.close();
      } catch (StoreException ex) {
        log.warn("Failed to close content store in {}", config.dataDir(), ex);
      }
      store = null;
    }
    if (metricsResource != null) {
      try {
        metricsResource.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics exporter", ex);
      }
    }
  }
}
