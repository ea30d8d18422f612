package dev.harvest.infrastructure.history;

import dev.harvest.application.port.RunHistoryPort;
import dev.harvest.domain.run.StageRun;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Volatile {@link RunHistoryPort} used by tests and dry runs.
 *
 * @since 0.1.0
 */
public final class InMemoryRunHistoryAdapter implements RunHistoryPort {
  private final List<StageRun> runs = new ArrayList<>();

  @Override
  public synchronized void record(StageRun run) {
    runs.add(Objects.requireNonNull(run, "run"));
  }

  @Override
  public synchronized Optional<StageRun> latest(String stage) {
    return newestFirst().stream().filter(run -> run.stage().equals(stage)).findFirst();
  }

  @Override
  public synchronized Optional<StageRun> latestEffective(String stage) {
    return newestFirst().stream()
        .filter(run -> run.stage().equals(stage) && run.isEffective())
        .findFirst();
  }

  @Override
  public synchronized List<StageRun> history(String stage, int limit) {
    return newestFirst().stream().filter(run -> run.stage().equals(stage)).limit(limit).toList();
  }

  @Override
  public synchronized List<StageRun> recent(int limit) {
    return newestFirst().stream().limit(limit).toList();
  }

  /** All runs in recording order. */
  public synchronized List<StageRun> all() {
    return List.copyOf(runs);
  }

  @Override
  public void close() {
    // nothing to release
  }

  private List<StageRun> newestFirst() {
    List<StageRun> copy = new ArrayList<>(runs);
    Collections.reverse(copy);
    return copy;
  }
}
