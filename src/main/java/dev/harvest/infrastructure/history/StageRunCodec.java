package dev.harvest.infrastructure.history;

import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.RunStats;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.run.StageFailure;
import dev.harvest.domain.run.StageRun;
import dev.harvest.domain.run.StalenessReason;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Maps {@link StageRun} values to and from the JSON object graph stored in the history log.
 *
 * @since 0.1.0
 */
final class StageRunCodec {
  private StageRunCodec() {}

  static Map<String, Object> toMap(StageRun run) {
    Map<String, Object> row = new LinkedHashMap<>();
    row.put("build", run.buildId());
    row.put("stage", run.stage());
    row.put("version", run.stageVersion());
    row.put("startedAt", run.startedAt().toString());
    row.put("finishedAt", run.finishedAt().toString());
    row.put("outcome", run.outcome().name());
    row.put("reason", run.reason().name());
    run.failure().ifPresent(failure -> {
      Map<String, Object> detail = new LinkedHashMap<>();
      detail.put("kind", failure.kind().name());
      detail.put("message", failure.message());
      detail.put("causeType", failure.causeType());
      row.put("failure", detail);
    });
    run.blockedBy().ifPresent(upstream -> row.put("blockedBy", upstream));
    run.inputFingerprint().ifPresent(fp -> row.put("inputFp", fp.hex()));
    run.outputFingerprint().ifPresent(fp -> row.put("outputFp", fp.hex()));
    RunStats stats = run.stats();
    row.put("items", stats.itemsProcessed());
    row.put("cacheHits", stats.cacheHits());
    row.put("cacheMisses", stats.cacheMisses());
    CommitSummary commit = run.commit();
    row.put("inserted", commit.inserted());
    row.put("updated", commit.updated());
    row.put("unchanged", commit.unchanged());
    row.put("affirmed", commit.affirmed());
    return row;
  }

  /**
   * Decodes one history row.
   *
   * @param row parsed JSON object
   * @return stage run
   * @throws IllegalArgumentException when a required field is missing or malformed
   */
  static StageRun fromMap(Map<String, Object> row) {
    Optional<StageFailure> failure = Optional.empty();
    if (row.get("failure") instanceof Map<?, ?> detail) {
      failure = Optional.of(new StageFailure(
          StageErrorKind.valueOf(text(detail.get("kind"), "failure.kind")),
          Objects.toString(detail.get("message"), ""),
          Objects.toString(detail.get("causeType"), "")));
    }
    return new StageRun(
        text(row.get("build"), "build"),
        text(row.get("stage"), "stage"),
        text(row.get("version"), "version"),
        Instant.parse(text(row.get("startedAt"), "startedAt")),
        Instant.parse(text(row.get("finishedAt"), "finishedAt")),
        RunOutcome.valueOf(text(row.get("outcome"), "outcome")),
        row.containsKey("reason")
            ? StalenessReason.valueOf(text(row.get("reason"), "reason"))
            : StalenessReason.NOT_EVALUATED,
        failure,
        Optional.ofNullable((String) row.get("blockedBy")),
        fingerprint(row.get("inputFp")),
        fingerprint(row.get("outputFp")),
        new RunStats(number(row, "items"), number(row, "cacheHits"), number(row, "cacheMisses")),
        new CommitSummary(
            number(row, "inserted"), number(row, "updated"), number(row, "unchanged"), number(row, "affirmed")));
  }

  private static Optional<Fingerprint> fingerprint(Object value) {
    return value == null ? Optional.empty() : Optional.of(Fingerprint.of(value.toString()));
  }

  private static long number(Map<String, Object> row, String field) {
    Object value = row.get(field);
    return value instanceof Number n ? n.longValue() : 0L;
  }

  private static String text(Object value, String field) {
    if (!(value instanceof String s) || s.isEmpty()) {
      throw new IllegalArgumentException("history row missing " + field);
    }
    return s;
  }
}
