package dev.harvest.application.pipeline;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.application.cache.ResilientCache;
import dev.harvest.application.cache.StageCache;
import dev.harvest.application.port.ClockPort;
import dev.harvest.application.port.ContentStorePort;
import dev.harvest.application.port.StoreException;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.UnownedVariantException;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.RunStats;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.run.StageFailure;
import dev.harvest.domain.run.StageRun;
import dev.harvest.domain.run.StalenessReason;
import dev.harvest.domain.stage.StageDescriptor;
import dev.harvest.logging.Logs;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Executes one stale stage inside its own store transaction.
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Bind a {@link StageCache} to the stage and open a transaction over its owned variants.</li>
 *   <li>Translate thrown exceptions into typed failures; roll back on any failure.</li>
 *   <li>Commit on success and fingerprint the records the stage affirmed.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Stateless apart from its collaborators; invoked concurrently from
 * stage workers.</p>
 * <p><strong>Observability:</strong> Sets MDC keys {@code build.id} and {@code stage} for the duration
 * of the run; failures are logged with the input fingerprint.</p>
 *
 * @since 0.1.0
 */
final class StageRunner {
  private static final Logger log = LoggerFactory.getLogger(StageRunner.class);
  private static final int MAX_DETAIL = 500;

  private final ContentStorePort store;
  private final ResilientCache cache;
  private final ClockPort clock;
  private final Duration cacheTtl;

  StageRunner(ContentStorePort store, ResilientCache cache, ClockPort clock, Duration cacheTtl) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.cacheTtl = Objects.requireNonNull(cacheTtl, "cacheTtl");
  }

  StageRun execute(Stage stage, String buildId, StalenessReason reason, Fingerprint inputFingerprint) {
    StageDescriptor descriptor = stage.descriptor();
    String name = descriptor.name();
    MDC.put("build.id", buildId);
    MDC.put("stage", name);
    Instant started = clock.now();
    StageCache stageCache = new StageCache(cache, descriptor, clock, cacheTtl);
    try (StoreTransaction tx = store.begin(name, descriptor.ownedVariants())) {
      log.info("Running stage {} ({}, input {})", name, reason, inputFingerprint.shortForm());
      StageResult result;
      try {
        result = stage.run(stageCache, tx);
        if (result == null) {
          result = StageResult.failed(StageErrorKind.UNEXPECTED, "stage returned no result");
        }
      } catch (UnownedVariantException ex) {
        result = StageResult.failed(StageErrorKind.OWNERSHIP_CONFLICT, "write outside owned variants", ex);
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        tx.rollback();
        log.warn("Stage {} interrupted; changes rolled back", name);
        return run(descriptor, buildId, started, RunOutcome.CANCELLED, reason, null, inputFingerprint,
            null, RunStats.EMPTY.withCache(stageCache.hits(), stageCache.misses()), CommitSummary.EMPTY);
      } catch (RuntimeException ex) {
        log.error("Stage {} failed unexpectedly (input {})", name, inputFingerprint.shortForm(), ex);
        result = StageResult.failed(StageErrorKind.UNEXPECTED, "unexpected error", ex);
      }
      RunStats stats = result.stats().withCache(stageCache.hits(), stageCache.misses());
      if (!result.isOk()) {
        tx.rollback();
        StageFailure failure = truncate(result.failure().orElseThrow());
        if (failure.kind() != StageErrorKind.UNEXPECTED) {
          log.warn("Stage {} failed (input {}): {}", name, inputFingerprint.shortForm(), failure,
              result.cause().orElse(null));
        }
        return run(descriptor, buildId, started, RunOutcome.FAILED, reason, failure, inputFingerprint,
            null, stats, CommitSummary.EMPTY);
      }
      CommitSummary commit;
      try {
        commit = tx.commit();
      } catch (StoreException ex) {
        log.error("Stage {} could not commit (input {})", name, inputFingerprint.shortForm(), ex);
        StageFailure failure = truncate(StageFailure.of(StageErrorKind.STORE, "commit failed", ex));
        return run(descriptor, buildId, started, RunOutcome.FAILED, reason, failure, inputFingerprint,
            null, stats, CommitSummary.EMPTY);
      }
      Fingerprint output = outputFingerprint(descriptor, buildId);
      log.info("Stage {} committed: {} inserted, {} updated, {} unchanged, {} affirmed",
          name, commit.inserted(), commit.updated(), commit.unchanged(), commit.affirmed());
      return run(descriptor, buildId, started, RunOutcome.SUCCESS, reason, null, inputFingerprint,
          output, stats, commit);
    } finally {
      MDC.remove("stage");
      MDC.remove("build.id");
    }
  }

  /**
   * Fingerprints the records of the stage's variants affirmed during {@code buildId}.
   *
   * @param descriptor stage descriptor
   * @param buildId current build
   * @return output fingerprint
   */
  Fingerprint outputFingerprint(StageDescriptor descriptor, String buildId) {
    List<ContentRecord> affirmed = new ArrayList<>();
    for (RecordVariant variant : descriptor.ownedVariants()) {
      affirmed.addAll(store.query(variant, record -> record.seenIn(buildId)));
    }
    return Fingerprints.forRecords(affirmed);
  }

  /**
   * Fingerprints every visible record of the stage's variants; used when no earlier output digest
   * was recorded.
   */
  Fingerprint currentFingerprint(StageDescriptor descriptor) {
    List<ContentRecord> all = new ArrayList<>();
    for (RecordVariant variant : descriptor.ownedVariants()) {
      all.addAll(store.query(variant, record -> true));
    }
    return Fingerprints.forRecords(all);
  }

  private StageRun run(
      StageDescriptor descriptor,
      String buildId,
      Instant started,
      RunOutcome outcome,
      StalenessReason reason,
      StageFailure failure,
      Fingerprint input,
      Fingerprint output,
      RunStats stats,
      CommitSummary commit) {
    Instant finished = clock.now();
    if (finished.isBefore(started)) {
      finished = started;
    }
    return new StageRun(
        buildId,
        descriptor.name(),
        descriptor.version(),
        started,
        finished,
        outcome,
        reason,
        Optional.ofNullable(failure),
        Optional.empty(),
        Optional.ofNullable(input),
        Optional.ofNullable(output),
        stats,
        commit);
  }

  private static StageFailure truncate(StageFailure failure) {
    return new StageFailure(failure.kind(), Logs.truncate(failure.message(), MAX_DETAIL), failure.causeType());
  }
}
