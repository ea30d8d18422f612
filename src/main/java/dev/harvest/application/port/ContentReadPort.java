package dev.harvest.application.port;

import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Read-only view of the content store used by stages and the site generator.
 *
 * @since 0.1.0
 */
public interface ContentReadPort {
  /**
   * Returns the visible records of a variant that match {@code predicate}, ordered by natural key.
   *
   * <p>While a build is open, records of a variant whose owner has already committed in this build
   * but did not affirm them are pending prune and are not returned.</p>
   *
   * @param variant record variant
   * @param predicate filter; use {@code r -> true} for all records
   * @return matching records
   */
  List<ContentRecord> query(RecordVariant variant, Predicate<ContentRecord> predicate);

  /**
   * Looks up a record by natural key, subject to the same visibility rule as {@link #query}.
   *
   * @param variant record variant
   * @param naturalKey natural key
   * @return the record when present and visible
   */
  Optional<ContentRecord> find(RecordVariant variant, String naturalKey);

  /**
   * Returns the variants that currently hold records or a recorded status.
   *
   * @return known variants
   */
  Set<RecordVariant> variants();

  /**
   * Reports how fresh a variant's data is after the latest build.
   *
   * @param variant record variant
   * @return status, {@link VariantStatus#UNKNOWN} when never recorded
   */
  VariantStatus status(RecordVariant variant);
}
