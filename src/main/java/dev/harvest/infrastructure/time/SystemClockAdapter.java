package dev.harvest.infrastructure.time;

import dev.harvest.application.port.ClockPort;
import java.time.Clock;
import java.time.Instant;

/**
 * {@link ClockPort} backed by the system UTC clock.
 *
 * @since 0.1.0
 */
public final class SystemClockAdapter implements ClockPort {
  private final Clock clock = Clock.systemUTC();

  @Override
  public Instant now() {
    return clock.instant();
  }
}
