package dev.harvest.application.cache;

import dev.harvest.application.port.CacheException;
import dev.harvest.application.port.CachePort;
import dev.harvest.application.port.MetricsPort;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.Fingerprint;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CachePort} decorator that never fails.
 * <p><strong>Behaviour:</strong> a {@link CacheException} from the delegate is logged at WARN, counted
 * as {@code cache.error} and degraded to a miss (reads) or a no-op (writes and evictions).</p>
 * <p><strong>Observability:</strong> counts {@code cache.hit} and {@code cache.miss} on every read.</p>
 * <p><strong>Thread-safety:</strong> as thread-safe as the delegate.</p>
 *
 * @since 0.1.0
 */
public final class ResilientCache implements CachePort {
  private static final Logger log = LoggerFactory.getLogger(ResilientCache.class);

  private final CachePort delegate;
  private final MetricsPort metrics;

  public ResilientCache(CachePort delegate, MetricsPort metrics) {
    this.delegate = Objects.requireNonNull(delegate, "delegate");
    this.metrics = Objects.requireNonNullElse(metrics, MetricsPort.NO_OP);
  }

  @Override
  public Optional<CacheEntry> get(Fingerprint key) {
    try {
      Optional<CacheEntry> entry = delegate.get(key);
      metrics.increment(entry.isPresent() ? "cache.hit" : "cache.miss");
      return entry;
    } catch (CacheException ex) {
      degrade("read", key, ex);
      metrics.increment("cache.miss");
      return Optional.empty();
    }
  }

  @Override
  public void put(CacheEntry entry) {
    try {
      delegate.put(entry);
    } catch (CacheException ex) {
      degrade("write", entry.key(), ex);
    }
  }

  @Override
  public boolean invalidate(Fingerprint key) {
    try {
      return delegate.invalidate(key);
    } catch (CacheException ex) {
      degrade("invalidate", key, ex);
      return false;
    }
  }

  @Override
  public int evictTag(String tag) {
    try {
      int removed = delegate.evictTag(tag);
      log.debug("Evicted {} cache entries tagged {}", removed, tag);
      return removed;
    } catch (CacheException ex) {
      metrics.increment("cache.error");
      log.warn("Cache eviction for tag {} failed; stale entries remain unreachable by key: {}",
          tag, ex.getMessage());
      return 0;
    }
  }

  private void degrade(String operation, Fingerprint key, CacheException ex) {
    metrics.increment("cache.error");
    log.warn("Cache {} failed for key {}; continuing without cache: {}",
        operation, key.shortForm(), ex.getMessage());
  }
}
