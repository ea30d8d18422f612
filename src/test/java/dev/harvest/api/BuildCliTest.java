package dev.harvest.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class BuildCliTest {
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
  void buildWithoutFeedsPublishesEmptySiteData() {
    Path exportDir = tempDir.resolve("site");

    ExitCode exit = BuildCli.run(args(exportDir));

    assertEquals(ExitCode.SUCCESS, exit, output.toString());
    assertTrue(Files.exists(exportDir.resolve("postings.json")));
    assertTrue(Files.exists(tempDir.resolve("data/history/runs.ndjson")));
    assertTrue(output.toString().contains("succeeded"), output.toString());
  }

  @Test
  void secondBuildSkipsStagesDownstreamOfUnchangedFeeds() {
    Path exportDir = tempDir.resolve("site");
    assertEquals(ExitCode.SUCCESS, BuildCli.run(args(exportDir)));
    output.getBuffer().setLength(0);

    assertEquals(ExitCode.SUCCESS, BuildCli.run(args(exportDir)));

    String normalizeLine = output.toString().lines()
        .filter(line -> line.trim().startsWith("normalize_postings"))
        .findFirst()
        .orElseThrow();
    assertTrue(normalizeLine.contains("SKIPPED_CACHED"), normalizeLine);
  }

  @Test
  void dryRunPrintsPlanWithoutExporting() {
    Path exportDir = tempDir.resolve("site");

    ExitCode exit = BuildCli.run(new String[] {
        "dataDir=" + tempDir.resolve("data"),
        "cacheDir=" + tempDir.resolve("cache"),
        "exportDir=" + exportDir,
        "metricsExporter=none",
        "--dry-run"});

    assertEquals(ExitCode.SUCCESS, exit, output.toString());
    assertTrue(output.toString().startsWith("Dry run "), output.toString());
    assertFalse(Files.exists(exportDir.resolve("postings.json")));
  }

  @Test
  void invalidWorkerCountPrintsUsage() {
    ExitCode exit = BuildCli.run(new String[] {
        "dataDir=" + tempDir.resolve("data"), "workers=0", "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(output.toString().startsWith("usage: build"), output.toString());
  }

  @Test
  void forcingUnknownStageIsInvalid() {
    Path exportDir = tempDir.resolve("site");
    String[] base = args(exportDir);
    String[] withForce = Arrays.copyOf(base, base.length + 1);
    withForce[base.length] = "force=fetch_feed";

    ExitCode exit = BuildCli.run(withForce);

    assertEquals(ExitCode.INVALID_ARGS, exit);
    assertTrue(output.toString().startsWith("usage: build"), output.toString());
    assertFalse(Files.exists(exportDir.resolve("postings.json")));
  }

  @Test
  void dryRunWithClearCacheIsRejected() {
    ExitCode exit = BuildCli.run(new String[] {
        "dataDir=" + tempDir.resolve("data"), "clearCache=fetch_feeds", "--dry-run",
        "metricsExporter=none"});

    assertEquals(ExitCode.INVALID_ARGS, exit);
  }

  @Test
  void missingConfigFileIsInvalid() {
    ExitCode exit = BuildCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, exit);
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, BuildCli.run(new String[] {"--help"}));
    assertTrue(output.toString().contains("--dry-run"));
  }

  private String[] args(Path exportDir) {
    return new String[] {
        "dataDir=" + tempDir.resolve("data"),
        "cacheDir=" + tempDir.resolve("cache"),
        "exportDir=" + exportDir,
        "metricsExporter=none",
        "workers=2"};
  }
}
