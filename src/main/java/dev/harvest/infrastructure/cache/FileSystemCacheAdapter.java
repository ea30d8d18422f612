package dev.harvest.infrastructure.cache;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.application.json.JsonSupport;
import dev.harvest.application.port.CacheException;
import dev.harvest.application.port.CachePort;
import dev.harvest.application.port.ClockPort;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.infrastructure.io.AtomicFiles;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.regex.Pattern;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link CachePort} persisting entries as files under a cache directory.
 * <p><strong>Layout:</strong> {@code <root>/<first two hex chars>/<fingerprint>.bin} holds the payload
 * and {@code <fingerprint>.meta.json} its metadata (content type, instants, tag, payload digest).
 * An entry exists once its metadata file exists; the payload is always written first.</p>
 * <p><strong>Thread-safety:</strong> Writes, deletions and expiry checks for one key are serialized
 * through lock striping; readers of different keys never contend.</p>
 * <p><strong>Integrity:</strong> a payload whose size or digest disagrees with its metadata is
 * discarded and read as a miss.</p>
 *
 * @since 0.1.0
 */
public final class FileSystemCacheAdapter implements CachePort {
  private static final Logger log = LoggerFactory.getLogger(FileSystemCacheAdapter.class);
  private static final int LOCK_STRIPES = 64;
  private static final String PAYLOAD_SUFFIX = ".bin";
  private static final String META_SUFFIX = ".meta.json";
  private static final Pattern HEX_NAME = Pattern.compile("^[0-9a-f]{64}$");

  private final Path root;
  private final ClockPort clock;
  private final JsonSupport json = JsonSupport.shared();
  private final ReentrantLock[] locks = new ReentrantLock[LOCK_STRIPES];

  /**
   * Creates an adapter rooted at {@code root}.
   *
   * @param root cache directory; created when missing
   * @param clock time source used for expiry checks
   * @throws IOException when the directory cannot be created
   */
  public FileSystemCacheAdapter(Path root, ClockPort clock) throws IOException {
    this.root = Files.createDirectories(Objects.requireNonNull(root, "root"));
    this.clock = Objects.requireNonNull(clock, "clock");
    for (int i = 0; i < LOCK_STRIPES; i++) {
      locks[i] = new ReentrantLock();
    }
  }

  public Path root() {
    return root;
  }

  @Override
  public Optional<CacheEntry> get(Fingerprint key) throws CacheException {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      Path metaPath = metaPath(key);
      if (!Files.exists(metaPath)) {
        return Optional.empty();
      }
      Map<String, Object> meta = json.parseObject(Files.readString(metaPath, StandardCharsets.UTF_8));
      Instant expiresAt = Instant.parse(requireText(meta, "expiresAt"));
      if (!clock.now().isBefore(expiresAt)) {
        log.debug("Cache entry {} expired at {}", key.shortForm(), expiresAt);
        delete(key);
        return Optional.empty();
      }
      byte[] payload = Files.readAllBytes(payloadPath(key));
      String expectedDigest = requireText(meta, "payloadSha256");
      if (!Fingerprints.ofBytes(payload).hex().equals(expectedDigest)) {
        log.warn("Cache entry {} failed its integrity check; discarding", key.shortForm());
        delete(key);
        return Optional.empty();
      }
      return Optional.of(new CacheEntry(
          key,
          payload,
          (String) meta.get("contentType"),
          Instant.parse(requireText(meta, "fetchedAt")),
          expiresAt,
          requireText(meta, "tag")));
    } catch (NoSuchFileException ex) {
      log.warn("Cache entry {} has metadata but no payload; discarding", key.shortForm());
      deleteQuietly(key);
      return Optional.empty();
    } catch (IOException ex) {
      throw new CacheException("Failed to read cache entry " + key.shortForm(), ex);
    } catch (IllegalArgumentException | DateTimeParseException ex) {
      log.warn("Cache entry {} has unreadable metadata; discarding: {}", key.shortForm(), ex.getMessage());
      deleteQuietly(key);
      return Optional.empty();
    } finally {
      lock.unlock();
    }
  }

  @Override
  public void put(CacheEntry entry) throws CacheException {
    Objects.requireNonNull(entry, "entry");
    Fingerprint key = entry.key();
    byte[] payload = entry.payload();
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("key", key.hex());
    meta.put("contentType", entry.contentType());
    meta.put("fetchedAt", entry.fetchedAt().toString());
    meta.put("expiresAt", entry.expiresAt().toString());
    meta.put("tag", entry.tag());
    meta.put("size", payload.length);
    meta.put("payloadSha256", Fingerprints.ofBytes(payload).hex());
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      Files.deleteIfExists(metaPath(key));
      AtomicFiles.write(payloadPath(key), payload);
      AtomicFiles.write(metaPath(key), json.write(meta).getBytes(StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new CacheException("Failed to write cache entry " + key.shortForm(), ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public boolean invalidate(Fingerprint key) throws CacheException {
    ReentrantLock lock = lockFor(key);
    lock.lock();
    try {
      return delete(key);
    } catch (IOException ex) {
      throw new CacheException("Failed to delete cache entry " + key.shortForm(), ex);
    } finally {
      lock.unlock();
    }
  }

  @Override
  public int evictTag(String tag) throws CacheException {
    Objects.requireNonNull(tag, "tag");
    int removed = 0;
    for (Path metaPath : listMetaFiles()) {
      Fingerprint key = keyOf(metaPath);
      ReentrantLock lock = lockFor(key);
      lock.lock();
      try {
        if (!Files.exists(metaPath)) {
          continue;
        }
        String entryTag;
        try {
          entryTag = (String) json.parseObject(Files.readString(metaPath, StandardCharsets.UTF_8)).get("tag");
        } catch (IllegalArgumentException ex) {
          log.warn("Removing cache entry {} with unreadable metadata", key.shortForm());
          entryTag = tag;
        }
        if (tag.equals(entryTag) && delete(key)) {
          removed++;
        }
      } catch (IOException ex) {
        throw new CacheException("Failed to evict cache entries tagged " + tag, ex);
      } finally {
        lock.unlock();
      }
    }
    log.info("Evicted {} cache entries tagged {}", removed, tag);
    return removed;
  }

  private List<Path> listMetaFiles() throws CacheException {
    List<Path> result = new ArrayList<>();
    try (DirectoryStream<Path> shards = Files.newDirectoryStream(root, Files::isDirectory)) {
      for (Path shard : shards) {
        try (DirectoryStream<Path> entries = Files.newDirectoryStream(shard, "*" + META_SUFFIX)) {
          for (Path entry : entries) {
            String name = entry.getFileName().toString();
            if (HEX_NAME.matcher(name.substring(0, name.length() - META_SUFFIX.length())).matches()) {
              result.add(entry);
            }
          }
        }
      }
    } catch (IOException ex) {
      throw new CacheException("Failed to list cache directory " + root, ex);
    }
    return result;
  }

  private boolean delete(Fingerprint key) throws IOException {
    boolean meta = Files.deleteIfExists(metaPath(key));
    boolean payload = Files.deleteIfExists(payloadPath(key));
    return meta || payload;
  }

  private void deleteQuietly(Fingerprint key) {
    try {
      delete(key);
    } catch (IOException ex) {
      log.warn("Failed to remove damaged cache entry {}: {}", key.shortForm(), ex.getMessage());
    }
  }

  private Path payloadPath(Fingerprint key) {
    return root.resolve(key.shard()).resolve(key.hex() + PAYLOAD_SUFFIX);
  }

  private Path metaPath(Fingerprint key) {
    return root.resolve(key.shard()).resolve(key.hex() + META_SUFFIX);
  }

  private static Fingerprint keyOf(Path metaPath) {
    String fileName = metaPath.getFileName().toString();
    return Fingerprint.of(fileName.substring(0, fileName.length() - META_SUFFIX.length()));
  }

  private ReentrantLock lockFor(Fingerprint key) {
    return locks[Math.floorMod(key.hex().hashCode(), LOCK_STRIPES)];
  }

  private static String requireText(Map<String, Object> meta, String field) {
    Object value = meta.get(field);
    if (!(value instanceof String text) || text.isBlank()) {
      throw new IllegalArgumentException("cache metadata missing " + field);
    }
    return text;
  }
}
