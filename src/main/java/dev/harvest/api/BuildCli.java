package dev.harvest.api;

import dev.harvest.application.graph.DependencyGraph;
import dev.harvest.application.graph.GraphException;
import dev.harvest.application.pipeline.AbortSignal;
import dev.harvest.application.pipeline.BuildReport;
import dev.harvest.application.pipeline.BuildUseCase;
import dev.harvest.application.port.StoreException;
import dev.harvest.config.BuildConfig;
import dev.harvest.config.CompositionRoot;
import dev.harvest.logging.LoggingConfigurator;
import dev.harvest.validation.Paths;
import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code harvest build}: runs the stage graph incrementally and prints a per-stage report.
 * <p>Exit status {@link ExitCode#SUCCESS} when every stage ended usable, {@link ExitCode#BUILD_FAILED}
 * otherwise.</p>
 *
 * @since 0.1.0
 */
public final class BuildCli {
  private static final Logger log = LoggerFactory.getLogger(BuildCli.class);
  private static final String SUMMARY_USAGE =
      "usage: build [dataDir=PATH] [cacheDir=PATH] [exportDir=PATH] [feeds.NAME=URL ...] "
          + "[force=STAGE,...] [--force-all] [timeout=SECONDS] [workers=N] [cacheTtl=SECONDS] "
          + "[clearCache=TAG,...] [--dry-run] [config=FILE] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      HARVEST incremental build

      Usage:
        build feeds.jobs=https://example.org/jobs.rss [options]

      Options:
        dataDir=PATH             Content store and run history (default ~/.harvest/data)
        cacheDir=PATH            Fetch cache (default ~/.harvest/cache)
        exportDir=PATH           Site data output (default ~/.harvest/site)
        feeds.NAME=URL           RSS or Atom feed to harvest; repeatable
        force=STAGE,...          Run the named stages even when up to date
        --force-all              Run every stage
        timeout=SECONDS          Cancel stages not yet started after this long (0 = none)
        workers=N                Concurrent stages, 1..64 (default 4)
        cacheTtl=SECONDS         Lifetime of fetched responses (default 3600)
        clearCache=TAG,...       Evict cache entries of these stages before building
        historyRetention=N       Runs kept per stage in the history (0 = all)
        userAgent=TEXT           HTTP User-Agent for feed requests
        requestTimeout=SECONDS   Per-request HTTP timeout (default 30)
        --dry-run                Print what would run without running anything
        config=FILE              YAML file with common/build sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        otelEndpoint=URL           OTLP metrics endpoint
        otelResourceAttributes=K=V Comma-separated OTel resource attributes
        --verbose                Enable DEBUG logging
        --help                   Show this message
      """;

  private BuildCli() {}

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
      log.debug("Verbose logging enabled for build CLI");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    if (input.hasFlag("--dry-run")) {
      kv.put("dryRun", "true");
    }
    if (input.hasFlag("--force-all")) {
      kv.put("forceAll", "true");
    }

    BuildConfig config;
    try {
      Map<String, String> configInputs = new LinkedHashMap<>(ConfigCliUtils.effectiveConfig("build", kv, log));
      TelemetryConfigurator.configureMetrics(configInputs);
      config = BuildConfig.fromMap(configInputs);
      boolean create = !config.dryRun();
      Paths.validateWritableDir("dataDir", config.dataDir(), create);
      Paths.validateWritableDir("cacheDir", config.cacheDir(), create);
      Paths.validateWritableDir("exportDir", config.exportDir(), create);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid build arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }
    if (config.feeds().isEmpty()) {
      log.warn("No feeds configured; fetch_feeds will produce no entries");
    }

    AbortSignal abort = new AbortSignal();
    Thread hook = new Thread(() -> abort.abort("shutdown requested"), "harvest-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try (CompositionRoot root = new CompositionRoot(config)) {
      DependencyGraph graph = root.stageGraph();
      for (String forced : config.forceStages()) {
        if (!graph.names().contains(forced)) {
          log.error("Invalid build arguments: force names unknown stage {}; known stages: {}",
              forced, graph.names());
          CliPrinter.println(SUMMARY_USAGE);
          return ExitCode.INVALID_ARGS;
        }
      }
      BuildUseCase useCase = root.buildUseCase();
      log.info("Starting build: stages={}, workers={}, dataDir={}, dryRun={}",
          graph.size(), config.workers(), config.dataDir(), config.dryRun());
      BuildReport report = useCase.run(graph, config.toOptions(abort));
      CliPrinter.printLines(BuildReportPrinter.format(report));
      if (report.isDryRun() || report.succeeded()) {
        return ExitCode.SUCCESS;
      }
      log.error("Build {} failed: {} stage(s) did not complete, {} store error(s)",
          report.buildId(), report.failures().size(), report.storeErrors().size());
      return ExitCode.BUILD_FAILED;
    } catch (GraphException ex) {
      log.error("Invalid stage graph: {}", ex.getMessage());
      return ExitCode.CONFIG_ERROR;
    } catch (StoreException ex) {
      log.error("Content store failure in {}", config.dataDir(), ex);
      return ExitCode.IO_ERROR;
    } catch (IOException ex) {
      log.error("I/O failure while preparing the build", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Build configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure during build", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeShutdownHook(hook);
    }
  }

  private static void removeShutdownHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; shutdown hook stays registered");
    }
  }
}
