package dev.harvest.application.pipeline;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Dry-run prediction for every stage, in execution order.
 *
 * @param entries one entry per registered stage
 * @since 0.1.0
 */
public record ExecutionPlan(List<PlanEntry> entries) {
  public ExecutionPlan {
    entries = List.copyOf(Objects.requireNonNull(entries, "entries"));
  }

  public Optional<PlanEntry> entry(String stage) {
    return entries.stream().filter(entry -> entry.stage().equals(stage)).findFirst();
  }

  /**
   * Counts entries with the given action.
   *
   * @param action predicted action
   * @return number of stages
   */
  public long count(PlanEntry.Action action) {
    return entries.stream().filter(entry -> entry.action() == action).count();
  }
}
