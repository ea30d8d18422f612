package dev.harvest.application.pipeline;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Cooperative abort flag shared between the caller of a build and its scheduler.
 * <p>Once raised, the scheduler starts no further stages; stages already running finish normally.</p>
 *
 * @since 0.1.0
 */
public final class AbortSignal {
  private final AtomicReference<String> reason = new AtomicReference<>();

  /**
   * Raises the signal. Later calls keep the first reason.
   *
   * @param why short human-readable reason
   */
  public void abort(String why) {
    reason.compareAndSet(null, why == null || why.isBlank() ? "aborted" : why);
  }

  public boolean isAborted() {
    return reason.get() != null;
  }

  public Optional<String> reason() {
    return Optional.ofNullable(reason.get());
  }
}
