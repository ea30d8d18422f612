package dev.harvest.domain.stage;

/**
 * Controls when a stage is considered stale beyond the version and upstream checks.
 *
 * @since 0.1.0
 */
public enum RefreshPolicy {
  /** Re-run only when the stage version, upstream outputs, or force flags demand it. */
  ON_INPUT_CHANGE,
  /**
   * Re-run on every build. Used by stages that read external sources, whose drift is only
   * observable by fetching; the fetch cache keeps those runs cheap.
   */
  EVERY_BUILD
}
