package dev.harvest.application.port;

import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import java.util.Map;
import java.util.Set;

/**
 * <strong>What:</strong> Writable content store shared by all stages.
 * <p><strong>Lifecycle:</strong> the scheduler calls {@link #openBuild(String)}, stages write through
 * {@link #begin(String, Set)} transactions, the scheduler prunes variants whose owner succeeded and
 * finally calls {@link #closeBuild(Map)}.</p>
 * <p><strong>Thread-safety:</strong> Transactions for different stages may commit concurrently; each
 * commit is atomic with respect to readers.</p>
 *
 * @since 0.1.0
 */
public interface ContentStorePort extends ContentReadPort, AutoCloseable {
  /**
   * Starts a build; later affirmations are stamped with {@code buildId}.
   *
   * @param buildId unique build identifier
   * @throws StoreException when build metadata cannot be persisted
   * @throws IllegalStateException when another build is open
   */
  void openBuild(String buildId) throws StoreException;

  /**
   * Begins a transaction for {@code stage}.
   *
   * @param stage writing stage
   * @param ownedVariants variants the stage may write
   * @return new transaction
   * @throws IllegalStateException when no build is open
   */
  StoreTransaction begin(String stage, Set<RecordVariant> ownedVariants);

  /**
   * Deletes records of {@code variant} not affirmed in the open build.
   *
   * @param variant variant whose owner ran successfully
   * @return number of records removed
   * @throws StoreException when the deletion cannot be persisted
   */
  int pruneUnseen(RecordVariant variant) throws StoreException;

  /**
   * Ends the open build and records per-variant freshness.
   *
   * @param statuses status for each variant owned by a registered stage
   * @throws StoreException when build metadata cannot be persisted
   */
  void closeBuild(Map<RecordVariant, VariantStatus> statuses) throws StoreException;

  /** Id of the build last opened, or empty when none ever ran. */
  String lastBuildId();

  @Override
  void close() throws StoreException;
}
