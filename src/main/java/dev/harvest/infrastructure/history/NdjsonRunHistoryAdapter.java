package dev.harvest.infrastructure.history;

import dev.harvest.application.json.JsonSupport;
import dev.harvest.application.port.RunHistoryPort;
import dev.harvest.domain.run.StageRun;
import dev.harvest.infrastructure.io.AtomicFiles;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link RunHistoryPort} appending one JSON object per line to
 * {@code <dir>/runs.ndjson}.
 * <p><strong>Recovery:</strong> the log is read fully on open; a torn or malformed line (for example
 * from a crash mid-append) is skipped with a warning, and an unterminated last line is ended before
 * new records are appended.</p>
 * <p><strong>Retention:</strong> with a positive retention the log is compacted on {@link #close()} so
 * that each stage keeps at most that many runs.</p>
 * <p><strong>Thread-safety:</strong> All methods are synchronized.</p>
 *
 * @since 0.1.0
 */
public final class NdjsonRunHistoryAdapter implements RunHistoryPort {
  private static final Logger log = LoggerFactory.getLogger(NdjsonRunHistoryAdapter.class);
  static final String FILE_NAME = "runs.ndjson";

  private final Path file;
  private final int retentionPerStage;
  private final JsonSupport json = JsonSupport.shared();
  private final List<StageRun> runs = new ArrayList<>();
  private FileChannel channel;

  /**
   * Opens the history log under {@code directory}.
   *
   * @param directory history directory; created when missing
   * @param retentionPerStage runs kept per stage on close; {@code 0} keeps everything
   * @throws IOException when the log cannot be read or opened for append
   */
  public NdjsonRunHistoryAdapter(Path directory, int retentionPerStage) throws IOException {
    Objects.requireNonNull(directory, "directory");
    if (retentionPerStage < 0) {
      throw new IllegalArgumentException("retentionPerStage must be >= 0");
    }
    Files.createDirectories(directory);
    this.file = directory.resolve(FILE_NAME);
    this.retentionPerStage = retentionPerStage;
    load();
    this.channel = openForAppend();
  }

  public Path file() {
    return file;
  }

  @Override
  public synchronized void record(StageRun run) throws IOException {
    Objects.requireNonNull(run, "run");
    if (channel == null) {
      throw new IOException("run history " + file + " is closed");
    }
    byte[] line = (json.write(StageRunCodec.toMap(run)) + "\n").getBytes(StandardCharsets.UTF_8);
    ByteBuffer buffer = ByteBuffer.wrap(line);
    while (buffer.hasRemaining()) {
      channel.write(buffer);
    }
    channel.force(false);
    runs.add(run);
  }

  @Override
  public synchronized Optional<StageRun> latest(String stage) {
    for (int i = runs.size() - 1; i >= 0; i--) {
      StageRun run = runs.get(i);
      if (run.stage().equals(stage)) {
        return Optional.of(run);
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized Optional<StageRun> latestEffective(String stage) {
    for (int i = runs.size() - 1; i >= 0; i--) {
      StageRun run = runs.get(i);
      if (run.stage().equals(stage) && run.isEffective()) {
        return Optional.of(run);
      }
    }
    return Optional.empty();
  }

  @Override
  public synchronized List<StageRun> history(String stage, int limit) {
    List<StageRun> result = new ArrayList<>();
    for (int i = runs.size() - 1; i >= 0 && result.size() < limit; i--) {
      StageRun run = runs.get(i);
      if (run.stage().equals(stage)) {
        result.add(run);
      }
    }
    return result;
  }

  @Override
  public synchronized List<StageRun> recent(int limit) {
    List<StageRun> result = new ArrayList<>();
    for (int i = runs.size() - 1; i >= 0 && result.size() < limit; i--) {
      result.add(runs.get(i));
    }
    return result;
  }

  /**
   * Rewrites the log keeping only the newest {@code keepPerStage} runs of each stage.
   *
   * @param keepPerStage runs to keep per stage; must be positive
   * @return number of runs removed
   * @throws IOException when the log cannot be rewritten
   */
  public synchronized int compact(int keepPerStage) throws IOException {
    if (keepPerStage <= 0) {
      throw new IllegalArgumentException("keepPerStage must be positive");
    }
    Map<String, Integer> seen = new HashMap<>();
    List<StageRun> kept = new ArrayList<>();
    for (int i = runs.size() - 1; i >= 0; i--) {
      StageRun run = runs.get(i);
      if (seen.merge(run.stage(), 1, Integer::sum) <= keepPerStage) {
        kept.add(0, run);
      }
    }
    int removed = runs.size() - kept.size();
    if (removed == 0) {
      return 0;
    }
    StringBuilder content = new StringBuilder();
    for (StageRun run : kept) {
      content.append(json.write(StageRunCodec.toMap(run))).append('\n');
    }
    boolean reopen = channel != null;
    if (reopen) {
      channel.close();
      channel = null;
    }
    AtomicFiles.write(file, content.toString().getBytes(StandardCharsets.UTF_8));
    runs.clear();
    runs.addAll(kept);
    if (reopen) {
      channel = openForAppend();
    }
    log.info("Compacted run history: removed {} runs, kept {}", removed, kept.size());
    return removed;
  }

  @Override
  public synchronized void close() throws IOException {
    if (channel == null) {
      return;
    }
    try {
      if (retentionPerStage > 0) {
        compact(retentionPerStage);
      }
    } finally {
      if (channel != null) {
        channel.close();
        channel = null;
      }
    }
  }

  private void load() throws IOException {
    if (!Files.exists(file)) {
      return;
    }
    int lineNumber = 0;
    int skipped = 0;
    try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      String line;
      while ((line = reader.readLine()) != null) {
        lineNumber++;
        if (line.isBlank()) {
          continue;
        }
        try {
          runs.add(StageRunCodec.fromMap(json.parseObject(line)));
        } catch (IllegalArgumentException | DateTimeParseException | ClassCastException ex) {
          skipped++;
          log.warn("Skipping unreadable run history line {} in {}: {}", lineNumber, file, ex.getMessage());
        }
      }
    }
    log.debug("Loaded {} runs from {} ({} skipped)", runs.size(), file, skipped);
  }

  private FileChannel openForAppend() throws IOException {
    boolean torn = endsWithTornLine();
    FileChannel opened = FileChannel.open(
        file, StandardOpenOption.CREATE, StandardOpenOption.WRITE, StandardOpenOption.APPEND);
    if (torn) {
      log.warn("Run history {} ends with an unterminated line; terminating it before appending", file);
      try {
        ByteBuffer newline = ByteBuffer.wrap(new byte[] {'\n'});
        while (newline.hasRemaining()) {
          opened.write(newline);
        }
        opened.force(false);
      } catch (IOException ex) {
        opened.close();
        throw ex;
      }
    }
    return opened;
  }

  private boolean endsWithTornLine() throws IOException {
    if (!Files.exists(file)) {
      return false;
    }
    try (FileChannel reader = FileChannel.open(file, StandardOpenOption.READ)) {
      long size = reader.size();
      if (size == 0) {
        return false;
      }
      ByteBuffer last = ByteBuffer.allocate(1);
      reader.read(last, size - 1);
      return last.get(0) != '\n';
    }
  }
}
