package dev.harvest.application.port;

import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.Fingerprint;
import java.util.Optional;

/**
 * <strong>What:</strong> Content-addressed store of fetched external payloads.
 * <p><strong>Why:</strong> Keeps incremental builds cheap and shields stages from rate limits.</p>
 * <p><strong>Contract:</strong> Entries are keyed by request fingerprint and tagged with the owning
 * stage. Expired entries read as a miss and are removed. Correctness of a build never depends on
 * the cache: an empty cache must reproduce the same records.</p>
 * <p><strong>Thread-safety:</strong> Implementations serialize writes per key and allow concurrent reads.</p>
 *
 * @since 0.1.0
 */
public interface CachePort {
  /**
   * Looks up a live entry.
   *
   * @param key request fingerprint
   * @return the entry, or empty on miss or expiry
   * @throws CacheException when the backing storage fails
   */
  Optional<CacheEntry> get(Fingerprint key) throws CacheException;

  /**
   * Stores or replaces an entry.
   *
   * @param entry entry to store
   * @throws CacheException when the backing storage fails
   */
  void put(CacheEntry entry) throws CacheException;

  /**
   * Removes a single entry.
   *
   * @param key request fingerprint
   * @return {@code true} when an entry was removed
   * @throws CacheException when the backing storage fails
   */
  boolean invalidate(Fingerprint key) throws CacheException;

  /**
   * Removes every entry carrying {@code tag}.
   *
   * @param tag owning stage name
   * @return number of entries removed
   * @throws CacheException when the backing storage fails
   */
  int evictTag(String tag) throws CacheException;
}
