package dev.harvest.domain.content;

/**
 * Counts produced by committing a stage transaction.
 *
 * @param inserted records created
 * @param updated records whose attributes changed
 * @param unchanged records upserted with identical attributes
 * @param affirmed records only marked as seen
 * @since 0.1.0
 */
public record CommitSummary(long inserted, long updated, long unchanged, long affirmed) {
  public static final CommitSummary EMPTY = new CommitSummary(0, 0, 0, 0);

  public CommitSummary {
    if (inserted < 0 || updated < 0 || unchanged < 0 || affirmed < 0) {
      throw new IllegalArgumentException("commit counts must be non-negative");
    }
  }

  /** Total records touched by the commit. */
  public long total() {
    return inserted + updated + unchanged + affirmed;
  }
}
