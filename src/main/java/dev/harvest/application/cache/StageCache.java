package dev.harvest.application.cache;

import dev.harvest.application.port.ClockPort;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.FetchRequest;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.stage.StageDescriptor;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Fetch cache handle bound to one stage's name and version.
 * <p><strong>Why:</strong> Stages describe requests; this handle derives their fingerprints so that a
 * version bump bypasses old entries, tags entries with the stage name, and counts hits and misses
 * for the stage run.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use by a stage that fans out fetches.</p>
 *
 * @since 0.1.0
 */
public final class StageCache {
  private static final Logger log = LoggerFactory.getLogger(StageCache.class);

  private final ResilientCache cache;
  private final String stage;
  private final String version;
  private final ClockPort clock;
  private final Duration defaultTtl;
  private final AtomicLong hits = new AtomicLong();
  private final AtomicLong misses = new AtomicLong();

  /**
   * Creates a handle.
   *
   * @param cache resilient cache shared by all stages
   * @param descriptor stage the handle is bound to
   * @param clock time source for fetch and expiry instants
   * @param defaultTtl time-to-live applied by {@link #fetch(FetchRequest, Fetcher)}
   */
  public StageCache(ResilientCache cache, StageDescriptor descriptor, ClockPort clock, Duration defaultTtl) {
    this.cache = Objects.requireNonNull(cache, "cache");
    Objects.requireNonNull(descriptor, "descriptor");
    this.stage = descriptor.name();
    this.version = descriptor.version();
    this.clock = Objects.requireNonNull(clock, "clock");
    this.defaultTtl = requirePositive(defaultTtl);
  }

  public String stage() {
    return stage;
  }

  /**
   * Derives the cache key of a request for this stage and version.
   *
   * @param request request description
   * @return fingerprint
   */
  public Fingerprint keyFor(FetchRequest request) {
    return Fingerprints.forRequest(stage, version, request);
  }

  /**
   * Looks up a cached response.
   *
   * @param request request description
   * @return live entry, or empty on miss, expiry or cache failure
   */
  public Optional<CacheEntry> get(FetchRequest request) {
    Optional<CacheEntry> entry = cache.get(keyFor(request));
    (entry.isPresent() ? hits : misses).incrementAndGet();
    return entry;
  }

  /**
   * Stores a response.
   *
   * @param request request description
   * @param payload response bytes
   * @param contentType response media type
   * @param ttl time-to-live
   * @return the stored entry
   */
  public CacheEntry put(FetchRequest request, byte[] payload, String contentType, Duration ttl) {
    Instant now = clock.now();
    CacheEntry entry = new CacheEntry(
        keyFor(request), payload, contentType, now, now.plus(requirePositive(ttl)), stage);
    cache.put(entry);
    return entry;
  }

  /**
   * Drops a cached response, e.g. after discovering it is unusable.
   *
   * @param request request description
   * @return {@code true} when an entry was removed
   */
  public boolean invalidate(FetchRequest request) {
    return cache.invalidate(keyFor(request));
  }

  /**
   * Returns the cached response or fetches and caches it with the default time-to-live.
   *
   * @param request request description
   * @param fetcher source access used on a miss
   * @return cached or freshly fetched entry
   * @throws IOException when the fetch fails
   * @throws InterruptedException when interrupted during the fetch
   */
  public CacheEntry fetch(FetchRequest request, Fetcher fetcher) throws IOException, InterruptedException {
    return fetch(request, defaultTtl, fetcher);
  }

  /**
   * Returns the cached response or fetches and caches it.
   *
   * @param request request description
   * @param ttl time-to-live of a freshly fetched entry
   * @param fetcher source access used on a miss
   * @return cached or freshly fetched entry
   * @throws IOException when the fetch fails
   * @throws InterruptedException when interrupted during the fetch
   */
  public CacheEntry fetch(FetchRequest request, Duration ttl, Fetcher fetcher)
      throws IOException, InterruptedException {
    Objects.requireNonNull(fetcher, "fetcher");
    Optional<CacheEntry> cached = get(request);
    if (cached.isPresent()) {
      log.debug("Cache hit for {} {}", stage, request.target());
      return cached.get();
    }
    log.debug("Cache miss for {} {}; fetching", stage, request.target());
    FetchedPayload payload = fetcher.fetch();
    return put(request, payload.body(), payload.contentType(), ttl);
  }

  public long hits() {
    return hits.get();
  }

  public long misses() {
    return misses.get();
  }

  private static Duration requirePositive(Duration ttl) {
    Objects.requireNonNull(ttl, "ttl");
    if (ttl.isNegative() || ttl.isZero()) {
      throw new IllegalArgumentException("ttl must be positive");
    }
    return ttl;
  }
}
