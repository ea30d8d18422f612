package dev.harvest.application.port.stage;

import dev.harvest.domain.run.RunStats;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.run.StageFailure;
import java.util.Objects;
import java.util.Optional;

/**
 * Typed outcome returned by {@link Stage#run}: either ok with statistics or a classified failure.
 *
 * @since 0.1.0
 */
public final class StageResult {
  private final RunStats stats;
  private final StageFailure failure;
  private final Throwable cause;

  private StageResult(RunStats stats, StageFailure failure, Throwable cause) {
    this.stats = stats;
    this.failure = failure;
    this.cause = cause;
  }

  /**
   * Successful result.
   *
   * @param stats work counters
   * @return ok result
   */
  public static StageResult ok(RunStats stats) {
    return new StageResult(Objects.requireNonNull(stats, "stats"), null, null);
  }

  /**
   * Successful result counting processed items.
   *
   * @param itemsProcessed number of source items handled
   * @return ok result
   */
  public static StageResult ok(long itemsProcessed) {
    return ok(RunStats.items(itemsProcessed));
  }

  /**
   * Failed result without an underlying exception.
   *
   * @param kind failure classification
   * @param message detail
   * @return failed result
   */
  public static StageResult failed(StageErrorKind kind, String message) {
    return new StageResult(RunStats.EMPTY, new StageFailure(kind, message, ""), null);
  }

  /**
   * Failed result wrapping the exception that caused it.
   *
   * @param kind failure classification
   * @param message context
   * @param cause underlying exception, logged by the scheduler
   * @return failed result
   */
  public static StageResult failed(StageErrorKind kind, String message, Throwable cause) {
    return new StageResult(RunStats.EMPTY, StageFailure.of(kind, message, cause), cause);
  }

  public boolean isOk() {
    return failure == null;
  }

  public RunStats stats() {
    return stats;
  }

  public Optional<StageFailure> failure() {
    return Optional.ofNullable(failure);
  }

  public Optional<Throwable> cause() {
    return Optional.ofNullable(cause);
  }

  @Override
  public String toString() {
    return isOk() ? "StageResult[ok, " + stats + "]" : "StageResult[failed, " + failure + "]";
  }
}
