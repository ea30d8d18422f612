package dev.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class HistoryCliTest {
  @TempDir Path tempDir;

  private StringWriter output;

  @BeforeEach
  void captureOutput() {
    output = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(output, true));
  }

  @AfterEach
  void restore() {
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void reportsMissingHistory() {
    ExitCode exit = HistoryCli.run(new String[] {"dataDir=" + tempDir.resolve("data")});

    assertEquals(ExitCode.SUCCESS, exit);
    assertTrue(output.toString().startsWith("No run history in "), output.toString());
  }

  @Test
  void listsRunsOfOneStageAfterBuild() {
    assertEquals(ExitCode.SUCCESS, BuildCli.run(new String[] {
        "dataDir=" + tempDir.resolve("data"),
        "cacheDir=" + tempDir.resolve("cache"),
        "exportDir=" + tempDir.resolve("site"),
        "metricsExporter=none"}));
    output.getBuffer().setLength(0);

    ExitCode exit = HistoryCli.run(new String[] {
        "dataDir=" + tempDir.resolve("data"), "stage=fetch_feeds", "limit=5"});

    assertEquals(ExitCode.SUCCESS, exit);
    String[] lines = output.toString().split("\\R");
    assertEquals(1, lines.length, output.toString());
    assertTrue(lines[0].contains("fetch_feeds"));
    assertTrue(lines[0].contains("SUCCESS"));
  }

  @Test
  void rejectsLimitOutOfRange() {
    ExitCode exit = HistoryCli.run(new String[] {"dataDir=" + tempDir, "limit=0"});

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(output.toString().startsWith("usage: history"));
  }
}
