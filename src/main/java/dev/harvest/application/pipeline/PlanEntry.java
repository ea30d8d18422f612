package dev.harvest.application.pipeline;

import dev.harvest.domain.run.StalenessReason;
import java.util.Objects;

/**
 * Predicted treatment of one stage in a dry run.
 *
 * @param stage stage name
 * @param action predicted action
 * @param reason staleness reason behind {@link Action#RUN}; {@link StalenessReason#UP_TO_DATE} otherwise
 * @since 0.1.0
 */
public record PlanEntry(String stage, Action action, StalenessReason reason) {
  public PlanEntry {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(action, "action");
    Objects.requireNonNull(reason, "reason");
  }

  /** Predicted action. */
  public enum Action {
    /** The stage is stale on its own and will run. */
    RUN,
    /** The stage is up to date and upstream outputs are known unchanged. */
    SKIP,
    /** The stage runs only if a running upstream changes its output. */
    RUN_IF_UPSTREAM_CHANGES
  }
}
