package dev.harvest.application.port.stage;

import dev.harvest.application.cache.StageCache;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.domain.stage.StageDescriptor;

/**
 * <strong>What:</strong> Plugin contract for a data-producing pipeline stage.
 * <p><strong>Role:</strong> Implemented once per external source or transformation and registered in
 * the stage catalog at startup.</p>
 * <p><strong>Contract:</strong> {@link #run} reads upstream records and external sources and writes
 * only to the variants its descriptor owns. Expected failures are reported through
 * {@link StageResult#failed}; the scheduler converts thrown exceptions into
 * {@code UNEXPECTED} failures.</p>
 * <p><strong>Thread-safety:</strong> {@link #run} is invoked at most once per build, but stages of
 * unrelated branches run concurrently.</p>
 *
 * @since 0.1.0
 */
public interface Stage {
  /**
   * Static description of the stage.
   *
   * @return descriptor; must return the same value on every call
   */
  StageDescriptor descriptor();

  /**
   * Executes the stage.
   *
   * @param cache fetch cache bound to this stage's name and version
   * @param store transaction committed by the scheduler when the result is ok
   * @return ok with run statistics, or a typed failure
   * @throws InterruptedException when the worker is interrupted while waiting on I/O
   */
  StageResult run(StageCache cache, StoreTransaction store) throws InterruptedException;

  /** Convenience accessor for the descriptor's name. */
  default String name() {
    return descriptor().name();
  }
}
