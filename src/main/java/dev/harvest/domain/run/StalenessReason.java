package dev.harvest.domain.run;

/**
 * Why the scheduler decided to execute (or skip) a stage.
 *
 * @since 0.1.0
 */
public enum StalenessReason {
  /** A force flag named the stage, or all stages were forced. */
  FORCED,
  /** The stage refreshes on every build. */
  EVERY_BUILD,
  /** No successful run was ever recorded. */
  NEVER_RUN,
  /** The latest recorded run failed, was blocked or cancelled. */
  PREVIOUS_RUN_INCOMPLETE,
  /** The stage version differs from that of its last successful run. */
  VERSION_CHANGED,
  /** An upstream stage produced different output since the last successful run. */
  UPSTREAM_CHANGED,
  /** Nothing changed; the stage is up to date. */
  UP_TO_DATE,
  /** The stage was never evaluated because an upstream failed or the build was cancelled. */
  NOT_EVALUATED;

  /** Whether the reason calls for executing the stage. */
  public boolean isStale() {
    return this != UP_TO_DATE && this != NOT_EVALUATED;
  }
}
