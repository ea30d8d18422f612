package dev.harvest.application.pipeline;

import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.StageRun;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * <strong>What:</strong> Result of one build invocation.
 * <p>Holds one {@link StageRun} per registered stage in execution order, the freshness status of each
 * owned variant, the number of records pruned per variant and any store errors raised after the stage
 * pass. A dry run carries only its {@link ExecutionPlan}.</p>
 *
 * @param buildId build identifier
 * @param startedAt start instant
 * @param finishedAt finish instant
 * @param runs stage runs in execution order
 * @param variantStatuses status per owned variant
 * @param pruned records removed per variant
 * @param storeErrors errors raised while pruning or closing the build
 * @param plan execution plan when the build was a dry run
 * @since 0.1.0
 */
public record BuildReport(
    String buildId,
    Instant startedAt,
    Instant finishedAt,
    List<StageRun> runs,
    Map<RecordVariant, VariantStatus> variantStatuses,
    Map<RecordVariant, Integer> pruned,
    List<String> storeErrors,
    Optional<ExecutionPlan> plan) {

  public BuildReport {
    Objects.requireNonNull(buildId, "buildId");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    runs = List.copyOf(runs);
    variantStatuses = Collections.unmodifiableMap(new TreeMap<>(variantStatuses));
    pruned = Collections.unmodifiableMap(new TreeMap<>(pruned));
    storeErrors = List.copyOf(storeErrors);
    plan = Objects.requireNonNullElse(plan, Optional.empty());
  }

  static BuildReport dryRun(String buildId, Instant at, ExecutionPlan plan) {
    return new BuildReport(buildId, at, at, List.of(), Map.of(), Map.of(), List.of(), Optional.of(plan));
  }

  /** Whether every stage ended usable and no store error occurred. */
  public boolean succeeded() {
    return storeErrors.isEmpty() && runs.stream().noneMatch(run -> run.outcome().failsBuild());
  }

  public boolean isDryRun() {
    return plan.isPresent();
  }

  /** Runs whose outcome fails the build, in execution order. */
  public List<StageRun> failures() {
    List<StageRun> result = new ArrayList<>();
    for (StageRun run : runs) {
      if (run.outcome().failsBuild()) {
        result.add(run);
      }
    }
    return result;
  }

  public Optional<StageRun> run(String stage) {
    return runs.stream().filter(run -> run.stage().equals(stage)).findFirst();
  }

  /**
   * Returns the outcome of a stage.
   *
   * @param stage stage name
   * @return outcome
   * @throws IllegalArgumentException when the stage is not part of the report
   */
  public RunOutcome outcome(String stage) {
    return run(stage)
        .map(StageRun::outcome)
        .orElseThrow(() -> new IllegalArgumentException("no run recorded for " + stage));
  }

  /** Number of stages per outcome. */
  public Map<RunOutcome, Integer> outcomeCounts() {
    Map<RunOutcome, Integer> counts = new EnumMap<>(RunOutcome.class);
    for (StageRun run : runs) {
      counts.merge(run.outcome(), 1, Integer::sum);
    }
    return counts;
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }
}
