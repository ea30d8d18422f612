package dev.harvest.infrastructure.cache;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.FetchRequest;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.support.MutableClock;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class FileSystemCacheAdapterTest {
  @TempDir
  Path root;

  private MutableClock clock;
  private FileSystemCacheAdapter cache;

  @BeforeEach
  void setUp() throws Exception {
    clock = MutableClock.startingAt("2024-04-01T09:00:00Z");
    cache = new FileSystemCacheAdapter(root, clock);
  }

  @Test
  void storedEntryIsReadBackFromAFreshAdapter() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss/>", Duration.ofHours(1));
    cache.put(entry);

    Optional<CacheEntry> loaded = new FileSystemCacheAdapter(root, clock).get(entry.key());

    assertTrue(loaded.isPresent());
    assertArrayEquals(entry.payload(), loaded.get().payload());
    assertEquals("application/rss+xml", loaded.get().contentType());
    assertEquals("fetch_feeds", loaded.get().tag());
    assertEquals(entry.expiresAt(), loaded.get().expiresAt());
    assertTrue(Files.exists(root.resolve(entry.key().shard()).resolve(entry.key().hex() + ".bin")));
  }

  @Test
  void expiredEntryReadsAsMissAndIsDeleted() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss/>", Duration.ofMinutes(5));
    cache.put(entry);

    clock.advance(Duration.ofMinutes(5));

    assertTrue(cache.get(entry.key()).isEmpty());
    assertFalse(Files.exists(root.resolve(entry.key().shard()).resolve(entry.key().hex() + ".meta.json")));
  }

  @Test
  void corruptedPayloadIsDiscarded() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss>original</rss>", Duration.ofHours(1));
    cache.put(entry);
    Files.writeString(root.resolve(entry.key().shard()).resolve(entry.key().hex() + ".bin"), "<rss>tampered</rss>");

    assertTrue(cache.get(entry.key()).isEmpty());
    assertTrue(cache.get(entry.key()).isEmpty());
  }

  @Test
  void missingPayloadIsAMiss() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss/>", Duration.ofHours(1));
    cache.put(entry);
    Files.delete(root.resolve(entry.key().shard()).resolve(entry.key().hex() + ".bin"));

    assertTrue(cache.get(entry.key()).isEmpty());
  }

  @Test
  void unreadableMetadataIsAMiss() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss/>", Duration.ofHours(1));
    cache.put(entry);
    Files.writeString(root.resolve(entry.key().shard()).resolve(entry.key().hex() + ".meta.json"), "{not json");

    assertTrue(cache.get(entry.key()).isEmpty());
  }

  @Test
  void evictTagRemovesOnlyMatchingEntries() throws Exception {
    CacheEntry first = entry("fetch_feeds", "https://a.example/rss", "a", Duration.ofHours(1));
    CacheEntry second = entry("fetch_feeds", "https://b.example/rss", "b", Duration.ofHours(1));
    CacheEntry other = entry("fetch_orgs", "https://orgs.example/api", "o", Duration.ofHours(1));
    cache.put(first);
    cache.put(second);
    cache.put(other);
    Files.writeString(root.resolve("README.txt"), "not a cache entry");

    assertEquals(2, cache.evictTag("fetch_feeds"));
    assertTrue(cache.get(first.key()).isEmpty());
    assertTrue(cache.get(other.key()).isPresent());
    assertEquals(0, cache.evictTag("fetch_feeds"));
  }

  @Test
  void invalidateReportsWhetherAnythingWasRemoved() throws Exception {
    CacheEntry entry = entry("fetch_feeds", "https://jobs.example/rss", "<rss/>", Duration.ofHours(1));
    cache.put(entry);

    assertTrue(cache.invalidate(entry.key()));
    assertFalse(cache.invalidate(entry.key()));
  }

  private CacheEntry entry(String tag, String url, String body, Duration ttl) {
    Fingerprint key = Fingerprints.forRequest(tag, "1", FetchRequest.of(url));
    Instant now = clock.now();
    return new CacheEntry(key, body.getBytes(StandardCharsets.UTF_8), "application/rss+xml", now, now.plus(ttl), tag);
  }
}
