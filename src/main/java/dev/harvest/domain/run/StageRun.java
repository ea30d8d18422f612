package dev.harvest.domain.run;

import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.content.CommitSummary;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Immutable record of one stage's outcome within one build.
 * <p><strong>Why:</strong> The scheduler compares the latest runs with the current graph to decide
 * staleness; operators read the same history to diagnose builds.</p>
 * <p><strong>Thread-safety:</strong> Immutable.</p>
 *
 * @param buildId build identifier
 * @param stage stage name
 * @param stageVersion stage version at the time of the run
 * @param startedAt start instant
 * @param finishedAt finish instant
 * @param outcome terminal outcome
 * @param reason staleness reason that led to the outcome
 * @param failure failure detail for {@link RunOutcome#FAILED}
 * @param blockedBy upstream stage responsible for {@link RunOutcome#BLOCKED}
 * @param inputFingerprint digest of version and upstream outputs, when evaluated
 * @param outputFingerprint digest of the records the stage owns after the run, when usable
 * @param stats work counters
 * @param commit store commit counts
 * @since 0.1.0
 */
public record StageRun(
    String buildId,
    String stage,
    String stageVersion,
    Instant startedAt,
    Instant finishedAt,
    RunOutcome outcome,
    StalenessReason reason,
    Optional<StageFailure> failure,
    Optional<String> blockedBy,
    Optional<Fingerprint> inputFingerprint,
    Optional<Fingerprint> outputFingerprint,
    RunStats stats,
    CommitSummary commit) {

  public StageRun {
    Objects.requireNonNull(buildId, "buildId");
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(stageVersion, "stageVersion");
    Objects.requireNonNull(startedAt, "startedAt");
    Objects.requireNonNull(finishedAt, "finishedAt");
    Objects.requireNonNull(outcome, "outcome");
    reason = Objects.requireNonNullElse(reason, StalenessReason.NOT_EVALUATED);
    failure = Objects.requireNonNullElse(failure, Optional.empty());
    blockedBy = Objects.requireNonNullElse(blockedBy, Optional.empty());
    inputFingerprint = Objects.requireNonNullElse(inputFingerprint, Optional.empty());
    outputFingerprint = Objects.requireNonNullElse(outputFingerprint, Optional.empty());
    stats = Objects.requireNonNullElse(stats, RunStats.EMPTY);
    commit = Objects.requireNonNullElse(commit, CommitSummary.EMPTY);
    if (finishedAt.isBefore(startedAt)) {
      throw new IllegalArgumentException("finishedAt must not precede startedAt for stage " + stage);
    }
    if (outcome == RunOutcome.FAILED && failure.isEmpty()) {
      throw new IllegalArgumentException("failed run of " + stage + " requires failure detail");
    }
  }

  public Duration duration() {
    return Duration.between(startedAt, finishedAt);
  }

  /**
   * Whether this run left usable records that later builds may build upon.
   *
   * @return {@code true} for {@link RunOutcome#SUCCESS} and {@link RunOutcome#SKIPPED_CACHED}
   */
  public boolean isEffective() {
    return outcome.isUsable();
  }
}
