package dev.harvest.application.pipeline;

import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.run.StageRun;
import dev.harvest.domain.run.StalenessReason;
import dev.harvest.domain.stage.RefreshPolicy;
import dev.harvest.domain.stage.StageDescriptor;
import java.util.Objects;
import java.util.Optional;

/**
 * <strong>What:</strong> Decides whether a stage must run in the current build.
 * <p>Signals are checked in a fixed order and the first match wins:</p>
 * <ol>
 *   <li>{@link StalenessReason#FORCED}: forced by name or globally.</li>
 *   <li>{@link StalenessReason#EVERY_BUILD}: the descriptor's refresh policy.</li>
 *   <li>{@link StalenessReason#NEVER_RUN}: no recorded run.</li>
 *   <li>{@link StalenessReason#VERSION_CHANGED}: the latest run used another version.</li>
 *   <li>{@link StalenessReason#PREVIOUS_RUN_INCOMPLETE}: the latest run failed, was blocked or cancelled.</li>
 *   <li>{@link StalenessReason#UPSTREAM_CHANGED}: the input fingerprint differs from the latest run's.</li>
 * </ol>
 * <p>Otherwise the stage is {@link StalenessReason#UP_TO_DATE}. Stateless and thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class StalenessEvaluator {

  /**
   * Evaluates the signals that do not depend on upstream outputs.
   *
   * @param descriptor stage descriptor
   * @param forced whether the build forces the stage
   * @param latest latest recorded run of the stage, whatever its outcome
   * @return reason when one of the intrinsic signals fires, empty when only inputs can decide
   */
  public Optional<StalenessReason> intrinsic(
      StageDescriptor descriptor, boolean forced, Optional<StageRun> latest) {
    Objects.requireNonNull(descriptor, "descriptor");
    if (forced) {
      return Optional.of(StalenessReason.FORCED);
    }
    if (descriptor.refreshPolicy() == RefreshPolicy.EVERY_BUILD) {
      return Optional.of(StalenessReason.EVERY_BUILD);
    }
    if (latest.isEmpty()) {
      return Optional.of(StalenessReason.NEVER_RUN);
    }
    StageRun run = latest.get();
    if (!run.stageVersion().equals(descriptor.version())) {
      return Optional.of(StalenessReason.VERSION_CHANGED);
    }
    if (!run.isEffective()) {
      return Optional.of(StalenessReason.PREVIOUS_RUN_INCOMPLETE);
    }
    return Optional.empty();
  }

  /**
   * Evaluates every signal.
   *
   * @param descriptor stage descriptor
   * @param forced whether the build forces the stage
   * @param latest latest recorded run of the stage
   * @param inputFingerprint fingerprint of the stage's current inputs
   * @return staleness reason; {@link StalenessReason#UP_TO_DATE} when the stage may be skipped
   */
  public StalenessReason evaluate(
      StageDescriptor descriptor, boolean forced, Optional<StageRun> latest, Fingerprint inputFingerprint) {
    Objects.requireNonNull(inputFingerprint, "inputFingerprint");
    Optional<StalenessReason> reason = intrinsic(descriptor, forced, latest);
    if (reason.isPresent()) {
      return reason.get();
    }
    Optional<Fingerprint> previous = latest.flatMap(StageRun::inputFingerprint);
    if (previous.isEmpty() || !previous.get().equals(inputFingerprint)) {
      return StalenessReason.UPSTREAM_CHANGED;
    }
    return StalenessReason.UP_TO_DATE;
  }

  /**
   * Whether the stage's cache entries were produced under another version and should be evicted.
   *
   * @param descriptor stage descriptor
   * @param latest latest recorded run
   * @return {@code true} when a previous run exists with a different version
   */
  public boolean versionChanged(StageDescriptor descriptor, Optional<StageRun> latest) {
    return latest.map(run -> !run.stageVersion().equals(descriptor.version())).orElse(false);
  }
}
