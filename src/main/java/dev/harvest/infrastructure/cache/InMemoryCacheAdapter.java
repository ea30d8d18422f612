package dev.harvest.infrastructure.cache;

import dev.harvest.application.port.CachePort;
import dev.harvest.application.port.ClockPort;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.Fingerprint;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Heap-backed {@link CachePort} for tests and {@code cacheDir=none} runs.
 *
 * @since 0.1.0
 */
public final class InMemoryCacheAdapter implements CachePort {
  private final ConcurrentMap<Fingerprint, CacheEntry> entries = new ConcurrentHashMap<>();
  private final ClockPort clock;

  public InMemoryCacheAdapter(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  @Override
  public Optional<CacheEntry> get(Fingerprint key) {
    CacheEntry entry = entries.get(key);
    if (entry == null) {
      return Optional.empty();
    }
    if (entry.isExpired(clock.now())) {
      entries.remove(key, entry);
      return Optional.empty();
    }
    return Optional.of(entry);
  }

  @Override
  public void put(CacheEntry entry) {
    entries.put(entry.key(), entry);
  }

  @Override
  public boolean invalidate(Fingerprint key) {
    return entries.remove(key) != null;
  }

  @Override
  public int evictTag(String tag) {
    int before = entries.size();
    entries.values().removeIf(entry -> entry.tag().equals(tag));
    return before - entries.size();
  }

  /** Number of stored entries, expired ones included. */
  public int size() {
    return entries.size();
  }
}
