package dev.harvest.application.port;

import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.UpsertResult;
import java.util.List;
import java.util.Map;
import java.util.function.Predicate;

/**
 * <strong>What:</strong> A stage's all-or-nothing unit of work against the content store.
 * <p><strong>Contract:</strong> Writes are staged in memory and become visible to other readers only
 * on {@link #commit()}. Writes to variants the stage does not own raise
 * {@link UnownedVariantException}. Closing an uncommitted transaction rolls it back.</p>
 * <p><strong>Thread-safety:</strong> Confined to the thread executing the stage.</p>
 *
 * @since 0.1.0
 */
public interface StoreTransaction extends AutoCloseable {
  /** Name of the stage the transaction writes for. */
  String stage();

  /**
   * Inserts or replaces the record under {@code naturalKey} and marks it seen in this build.
   * Repeating the same upsert has no further effect.
   *
   * @param variant owned variant
   * @param naturalKey natural key, unique within the variant
   * @param attributes JSON-compatible attribute map
   * @return effect relative to the committed store
   * @throws UnownedVariantException when the stage does not own {@code variant}
   */
  UpsertResult upsert(RecordVariant variant, String naturalKey, Map<String, ?> attributes);

  /**
   * Affirms an existing record without changing its attributes, protecting it from pruning.
   *
   * @param variant owned variant
   * @param naturalKey natural key
   * @return {@code true} when a record exists under the key
   * @throws UnownedVariantException when the stage does not own {@code variant}
   */
  boolean markSeen(RecordVariant variant, String naturalKey);

  /**
   * Queries committed records overlaid with this transaction's staged writes.
   *
   * @param variant record variant (owned or upstream)
   * @param predicate filter
   * @return matching records ordered by natural key
   */
  List<ContentRecord> query(RecordVariant variant, Predicate<ContentRecord> predicate);

  /**
   * Applies every staged write atomically.
   *
   * @return commit counts
   * @throws StoreException when the store cannot persist the writes; nothing is applied
   * @throws IllegalStateException when the transaction was already completed
   */
  CommitSummary commit() throws StoreException;

  /** Discards every staged write. Idempotent. */
  void rollback();

  /** Rolls back when neither {@link #commit()} nor {@link #rollback()} was called. */
  @Override
  void close();
}
