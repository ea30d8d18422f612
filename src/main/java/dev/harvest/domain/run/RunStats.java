package dev.harvest.domain.run;

/**
 * Counters describing the work a stage run performed.
 *
 * @param itemsProcessed source items the stage handled (feed entries, rows, pages)
 * @param cacheHits fetches served from the cache
 * @param cacheMisses fetches that went to the source
 * @since 0.1.0
 */
public record RunStats(long itemsProcessed, long cacheHits, long cacheMisses) {
  public static final RunStats EMPTY = new RunStats(0, 0, 0);

  public RunStats {
    if (itemsProcessed < 0 || cacheHits < 0 || cacheMisses < 0) {
      throw new IllegalArgumentException("run stats must be non-negative");
    }
  }

  public static RunStats items(long count) {
    return new RunStats(count, 0, 0);
  }

  /**
   * Returns a copy carrying cache counters collected by the scheduler.
   *
   * @param hits cache hits
   * @param misses cache misses
   * @return updated stats
   */
  public RunStats withCache(long hits, long misses) {
    return new RunStats(itemsProcessed, hits, misses);
  }
}
