package dev.harvest.domain.cache;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * Cached response payload keyed by request fingerprint.
 *
 * @param key request fingerprint
 * @param payload raw response bytes
 * @param contentType media type reported by the source, or {@code application/octet-stream}
 * @param fetchedAt instant the payload was fetched
 * @param expiresAt instant after which the entry reads as a miss
 * @param tag owning stage name, used for bulk eviction
 * @since 0.1.0
 */
public record CacheEntry(
    Fingerprint key,
    byte[] payload,
    String contentType,
    Instant fetchedAt,
    Instant expiresAt,
    String tag) {

  public CacheEntry {
    Objects.requireNonNull(key, "key");
    payload = Objects.requireNonNull(payload, "payload").clone();
    contentType = contentType == null || contentType.isBlank()
        ? "application/octet-stream"
        : contentType.trim();
    Objects.requireNonNull(fetchedAt, "fetchedAt");
    Objects.requireNonNull(expiresAt, "expiresAt");
    Objects.requireNonNull(tag, "tag");
    if (expiresAt.isBefore(fetchedAt)) {
      throw new IllegalArgumentException("expiresAt must not precede fetchedAt");
    }
  }

  @Override
  public byte[] payload() {
    return payload.clone();
  }

  public int size() {
    return payload.length;
  }

  /**
   * Indicates whether the entry has expired at {@code now}.
   *
   * @param now instant to evaluate against
   * @return {@code true} when {@code now} is at or after {@link #expiresAt()}
   */
  public boolean isExpired(Instant now) {
    return !now.isBefore(expiresAt);
  }

  @Override
  public boolean equals(Object other) {
    if (this == other) {
      return true;
    }
    if (!(other instanceof CacheEntry that)) {
      return false;
    }
    return key.equals(that.key)
        && Arrays.equals(payload, that.payload)
        && contentType.equals(that.contentType)
        && fetchedAt.equals(that.fetchedAt)
        && expiresAt.equals(that.expiresAt)
        && tag.equals(that.tag);
  }

  @Override
  public int hashCode() {
    int result = Objects.hash(key, contentType, fetchedAt, expiresAt, tag);
    return 31 * result + Arrays.hashCode(payload);
  }

  @Override
  public String toString() {
    return "CacheEntry[key=" + key.shortForm() + ", size=" + payload.length
        + ", contentType=" + contentType + ", expiresAt=" + expiresAt + ", tag=" + tag + "]";
  }
}
