package dev.harvest.domain.run;

/**
 * Terminal state of a stage within one build.
 *
 * @since 0.1.0
 */
public enum RunOutcome {
  /** The run function executed and its transaction committed. */
  SUCCESS,
  /** The run function reported an error or its commit failed; the transaction was rolled back. */
  FAILED,
  /** The stage was not stale; previous records stand. */
  SKIPPED_CACHED,
  /** An upstream stage did not produce usable output; the stage never executed. */
  BLOCKED,
  /** The build timed out or was aborted before the stage could start. */
  CANCELLED;

  /**
   * Whether downstream stages may consume the stage's records.
   *
   * @return {@code true} for {@link #SUCCESS} and {@link #SKIPPED_CACHED}
   */
  public boolean isUsable() {
    return this == SUCCESS || this == SKIPPED_CACHED;
  }

  /**
   * Whether the outcome makes the build fail.
   *
   * @return {@code true} for {@link #FAILED}, {@link #BLOCKED} and {@link #CANCELLED}
   */
  public boolean failsBuild() {
    return !isUsable();
  }
}
