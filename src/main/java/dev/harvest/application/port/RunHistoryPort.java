package dev.harvest.application.port;

import dev.harvest.domain.run.StageRun;
import java.io.IOException;
import java.util.List;
import java.util.Optional;

/**
 * Durable log of stage runs consulted by the scheduler's staleness checks.
 *
 * @since 0.1.0
 */
public interface RunHistoryPort extends AutoCloseable {
  /**
   * Appends a run.
   *
   * @param run completed stage run
   * @throws IOException when the run cannot be persisted
   */
  void record(StageRun run) throws IOException;

  /**
   * Latest recorded run of a stage, whatever its outcome.
   *
   * @param stage stage name
   * @return most recent run
   */
  Optional<StageRun> latest(String stage);

  /**
   * Latest run of a stage whose outcome left usable records.
   *
   * @param stage stage name
   * @return most recent successful or skipped run
   */
  Optional<StageRun> latestEffective(String stage);

  /**
   * Recorded runs of a stage, newest first.
   *
   * @param stage stage name
   * @param limit maximum number of runs returned
   * @return runs, newest first
   */
  List<StageRun> history(String stage, int limit);

  /**
   * Recorded runs across all stages, newest first.
   *
   * @param limit maximum number of runs returned
   * @return runs, newest first
   */
  List<StageRun> recent(int limit);

  @Override
  void close() throws IOException;
}
