package dev.harvest.application.port;

import java.time.Instant;

/**
 * <strong>What:</strong> Port supplying wall-clock time to the scheduler, cache and store.
 * <p><strong>Why:</strong> Cache expiry and run timing must be testable without sleeping.</p>
 * <p><strong>Thread-safety:</strong> Implementations must be safe for concurrent reads from worker
 * threads.</p>
 *
 * @since 0.1.0
 * @see dev.harvest.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current instant.
   *
   * @return current wall-clock instant
   */
  Instant now();

  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since the epoch
   */
  default long nowMillis() {
    return now().toEpochMilli();
  }

  /** Default clock backed by {@link Instant#now()}. */
  ClockPort SYSTEM = Instant::now;
}
