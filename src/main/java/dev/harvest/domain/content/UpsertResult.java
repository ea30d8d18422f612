package dev.harvest.domain.content;

/**
 * Effect of a single upsert on the content store.
 *
 * @since 0.1.0
 */
public enum UpsertResult {
  /** No record existed under the natural key. */
  INSERTED,
  /** A record existed and its attributes changed. */
  UPDATED,
  /** A record existed with identical attributes; only its last-seen metadata moves. */
  UNCHANGED
}
