package dev.harvest.api;

import dev.harvest.config.CompositionRoot;
import dev.harvest.domain.run.StageRun;
import dev.harvest.infrastructure.history.NdjsonRunHistoryAdapter;
import dev.harvest.logging.LoggingConfigurator;
import dev.harvest.validation.Numbers;
import dev.harvest.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code harvest history}: prints recorded stage runs, newest first.
 *
 * @since 0.1.0
 */
public final class HistoryCli {
  private static final Logger log = LoggerFactory.getLogger(HistoryCli.class);
  private static final String SUMMARY_USAGE = "usage: history [dataDir=PATH] [stage=NAME] [limit=N] [config=FILE]";
  private static final String HELP_TEXT = """
      HARVEST run history

      Usage:
        history [stage=NAME] [limit=N]

      Options:
        dataDir=PATH   Data directory holding history/runs.ndjson (default ~/.harvest/data)
        stage=NAME     Only show runs of this stage
        limit=N        Maximum runs to show, 1..10000 (default 20)
        config=FILE    YAML file with common/history sections
        --verbose      Enable DEBUG logging
        --help         Show this message
      """;

  private HistoryCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path historyDir;
    String stage;
    int limit;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("history", kv, log);
      historyDir = CompositionRoot.historyDirectory(
          Path.of(Strings.requireNonBlank("dataDir", effective.get("dataDir"))));
      String rawStage = effective.getOrDefault("stage", "");
      stage = rawStage.isBlank() ? null : Strings.requireTag("stage", rawStage);
      limit = (int) Numbers.parseRange("limit", effective.get("limit"), 1, 10_000);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid history arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    if (!Files.isDirectory(historyDir)) {
      CliPrinter.println("No run history in " + historyDir);
      return ExitCode.SUCCESS;
    }
    try (NdjsonRunHistoryAdapter history = new NdjsonRunHistoryAdapter(historyDir, 0)) {
      List<StageRun> runs = stage == null ? history.recent(limit) : history.history(stage, limit);
      CliPrinter.printLines(format(runs));
      return ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Unable to read run history in {}", historyDir, ex);
      return ExitCode.IO_ERROR;
    }
  }

  static List<String> format(List<StageRun> runs) {
    List<String> lines = new ArrayList<>();
    if (runs.isEmpty()) {
      lines.add("No recorded runs");
      return lines;
    }
    for (StageRun run : runs) {
      StringBuilder line = new StringBuilder(String.format(Locale.ROOT,
          "%s  %-24s v%-8s %-15s %-24s %6d ms",
          run.buildId(), run.stage(), run.stageVersion(), run.outcome(), run.reason(),
          run.duration().toMillis()));
      run.failure().ifPresent(failure -> line.append("  ").append(failure));
      run.blockedBy().ifPresent(upstream -> line.append("  blocked by ").append(upstream));
      lines.add(line.toString());
    }
    return lines;
  }
}
