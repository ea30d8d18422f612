package dev.harvest.application.pipeline;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.application.cache.ResilientCache;
import dev.harvest.application.graph.DependencyGraph;
import dev.harvest.application.graph.GraphException;
import dev.harvest.application.port.ClockPort;
import dev.harvest.application.port.ContentStorePort;
import dev.harvest.application.port.MetricsPort;
import dev.harvest.application.port.RunHistoryPort;
import dev.harvest.application.port.StoreException;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.domain.cache.Fingerprint;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.RunStats;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.run.StageFailure;
import dev.harvest.domain.run.StageRun;
import dev.harvest.domain.run.StalenessReason;
import dev.harvest.domain.stage.StageDescriptor;
import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.IntFunction;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

/**
 * <strong>What:</strong> Incremental build scheduler over a validated {@link DependencyGraph}.
 * <p><strong>Why:</strong> Re-runs only stale stages, isolates failures to their dependents and keeps the
 * content store consistent across partial failures.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Walk stages in topological order, starting each as soon as all of its dependencies finished.</li>
 *   <li>Decide staleness through {@link StalenessEvaluator} and input fingerprints; skip the rest.</li>
 *   <li>Run stale stages on a bounded worker pool; mark dependents of failed stages {@code BLOCKED}.</li>
 *   <li>Stop scheduling on timeout or abort; never-started stages end {@code CANCELLED}.</li>
 *   <li>Prune variants whose owner succeeded and record per-variant freshness.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> One build at a time per instance; scheduling decisions happen on the
 * calling thread while stage bodies run on workers.</p>
 * <p><strong>Observability:</strong> Emits {@code build.stage.<outcome>}, {@code build.stage.duration.ms},
 * {@code store.commit.records} and {@code store.prune.removed}; logs carry MDC {@code build.id}.</p>
 *
 * @since 0.1.0
 */
public final class BuildUseCase {
  private static final Logger log = LoggerFactory.getLogger(BuildUseCase.class);
  private static final long POLL_MILLIS = 100;

  private final ContentStorePort store;
  private final ResilientCache cache;
  private final RunHistoryPort history;
  private final ClockPort clock;
  private final MetricsPort metrics;
  private final int workers;
  private final IntFunction<ExecutorService> pools;
  private final StalenessEvaluator evaluator = new StalenessEvaluator();
  private final StageRunner runner;

  /**
   * Creates a scheduler.
   *
   * @param store content store shared by all stages
   * @param cache fetch cache shared by all stages
   * @param history run history used for staleness and appended with every run
   * @param clock time source
   * @param metrics metrics sink
   * @param workers maximum number of concurrently running stages
   * @param cacheTtl default time-to-live of fetched entries
   * @param pools factory creating a worker pool of the requested size for each build
   */
  public BuildUseCase(
      ContentStorePort store,
      ResilientCache cache,
      RunHistoryPort history,
      ClockPort clock,
      MetricsPort metrics,
      int workers,
      Duration cacheTtl,
      IntFunction<ExecutorService> pools) {
    this.store = Objects.requireNonNull(store, "store");
    this.cache = Objects.requireNonNull(cache, "cache");
    this.history = Objects.requireNonNull(history, "history");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (workers <= 0) {
      throw new IllegalArgumentException("workers must be positive");
    }
    this.workers = workers;
    this.pools = Objects.requireNonNull(pools, "pools");
    this.runner = new StageRunner(store, cache, clock, cacheTtl);
  }

  /**
   * Runs one build.
   *
   * @param graph stage graph; validated (and sealed) by this call
   * @param options force set, timeout, dry-run flag and abort signal
   * @return per-stage report; a dry run returns only the plan
   * @throws GraphException when the graph is invalid; nothing runs in that case
   * @throws StoreException when the build cannot be opened or closed in the content store
   * @throws IllegalArgumentException when a registered stage has no implementation or a forced
   *     stage is not registered
   */
  public BuildReport run(DependencyGraph graph, BuildOptions options) throws GraphException, StoreException {
    Objects.requireNonNull(graph, "graph");
    Objects.requireNonNull(options, "options");
    List<String> order = graph.topologicalOrder();
    requireKnownForcedStages(graph, options);
    Instant startedAt = clock.now();
    String buildId = BuildIds.next(startedAt);
    if (options.dryRun()) {
      ExecutionPlan plan = plan(graph, options);
      log.info("Dry run {}: {} stages would run, {} would skip, {} depend on upstream changes",
          buildId, plan.count(PlanEntry.Action.RUN), plan.count(PlanEntry.Action.SKIP),
          plan.count(PlanEntry.Action.RUN_IF_UPSTREAM_CHANGES));
      return BuildReport.dryRun(buildId, startedAt, plan);
    }
    for (String name : order) {
      if (graph.stage(name).isEmpty()) {
        throw new IllegalArgumentException("stage " + name + " has no implementation registered");
      }
    }
    for (String tag : options.clearCacheTags()) {
      cache.evictTag(tag);
    }

    MDC.put("build.id", buildId);
    try {
      store.openBuild(buildId);
      log.info("Build {} started: {} stages, {} workers", buildId, order.size(), workers);
      Map<String, StageRun> runs = walk(graph, order, options, buildId, startedAt);

      Map<RecordVariant, VariantStatus> statuses = new TreeMap<>();
      Map<RecordVariant, Integer> pruned = new TreeMap<>();
      List<String> storeErrors = new ArrayList<>();
      graph.owners().forEach((variant, owner) -> {
        RunOutcome outcome = runs.get(owner).outcome();
        if (outcome == RunOutcome.SKIPPED_CACHED) {
          statuses.put(variant, VariantStatus.CARRIED_OVER);
        } else if (outcome != RunOutcome.SUCCESS) {
          statuses.put(variant, VariantStatus.PARTIAL);
        } else {
          try {
            int removed = store.pruneUnseen(variant);
            pruned.put(variant, removed);
            metrics.observe("store.prune.removed", removed);
            statuses.put(variant, VariantStatus.FRESH);
          } catch (StoreException ex) {
            log.error("Failed to prune unseen {} records", variant, ex);
            storeErrors.add("prune " + variant + ": " + ex.getMessage());
            statuses.put(variant, VariantStatus.PARTIAL);
          }
        }
      });
      store.closeBuild(statuses);

      List<StageRun> ordered = new ArrayList<>(order.size());
      for (String name : order) {
        ordered.add(runs.get(name));
      }
      BuildReport report = new BuildReport(
          buildId, startedAt, clock.now(), ordered, statuses, pruned, storeErrors, Optional.empty());
      Map<RunOutcome, Integer> counts = report.outcomeCounts();
      if (report.succeeded()) {
        log.info("Build {} succeeded in {} ms: {}", buildId, report.duration().toMillis(), counts);
      } else {
        log.warn("Build {} failed in {} ms: {}", buildId, report.duration().toMillis(), counts);
      }
      return report;
    } finally {
      MDC.remove("build.id");
    }
  }

  /**
   * Predicts which stages a build would run, without fetching, running or writing anything.
   *
   * @param graph stage graph; validated by this call
   * @param options force flags are honoured; timeout and abort are ignored
   * @return plan in execution order
   * @throws GraphException when the graph is invalid
   * @throws IllegalArgumentException when a forced stage is not registered
   */
  public ExecutionPlan plan(DependencyGraph graph, BuildOptions options) throws GraphException {
    List<String> order = graph.topologicalOrder();
    requireKnownForcedStages(graph, options);
    Map<String, PlanEntry> entries = new LinkedHashMap<>();
    for (String name : order) {
      StageDescriptor descriptor = graph.descriptor(name);
      Optional<StageRun> latest = history.latest(name);
      Optional<StalenessReason> intrinsic = evaluator.intrinsic(descriptor, options.isForced(name), latest);
      if (intrinsic.isPresent()) {
        entries.put(name, new PlanEntry(name, PlanEntry.Action.RUN, intrinsic.get()));
        continue;
      }
      boolean upstreamMayChange = descriptor.dependencies().stream()
          .anyMatch(dependency -> entries.get(dependency).action() != PlanEntry.Action.SKIP);
      if (upstreamMayChange) {
        entries.put(name, new PlanEntry(name, PlanEntry.Action.RUN_IF_UPSTREAM_CHANGES, StalenessReason.UP_TO_DATE));
        continue;
      }
      Map<String, Fingerprint> upstream = new TreeMap<>();
      for (String dependency : descriptor.dependencies()) {
        history.latest(dependency).flatMap(StageRun::outputFingerprint)
            .ifPresent(fp -> upstream.put(dependency, fp));
      }
      StalenessReason reason = evaluator.evaluate(
          descriptor, false, latest, Fingerprints.forInputs(name, descriptor.version(), upstream));
      entries.put(name, new PlanEntry(
          name, reason.isStale() ? PlanEntry.Action.RUN : PlanEntry.Action.SKIP, reason));
    }
    return new ExecutionPlan(new ArrayList<>(entries.values()));
  }

  private static void requireKnownForcedStages(DependencyGraph graph, BuildOptions options) {
    Set<String> known = graph.names();
    for (String name : options.forceStages()) {
      if (!known.contains(name)) {
        throw new IllegalArgumentException("force names unknown stage " + name + "; known stages: " + known);
      }
    }
  }

  private Map<String, StageRun> walk(
      DependencyGraph graph, List<String> order, BuildOptions options, String buildId, Instant startedAt) {
    Map<String, Integer> position = new HashMap<>();
    Map<String, Integer> waitingOn = new HashMap<>();
    for (int i = 0; i < order.size(); i++) {
      String name = order.get(i);
      position.put(name, i);
      waitingOn.put(name, graph.descriptor(name).dependencies().size());
    }
    PriorityQueue<String> ready = new PriorityQueue<>(Comparator.comparing(position::get));
    waitingOn.forEach((name, count) -> {
      if (count == 0) {
        ready.add(name);
      }
    });
    Optional<Instant> deadline = options.timeout().map(startedAt::plus);
    Map<String, StageRun> runs = new HashMap<>();
    Map<String, Fingerprint> outputs = new HashMap<>();
    Map<Future<StageRun>, String> inFlight = new HashMap<>();
    boolean stopped = false;
    boolean interrupted = false;

    ExecutorService pool = pools.apply(workers);
    CompletionService<StageRun> completions = new ExecutorCompletionService<>(pool);
    try {
      while (true) {
        if (!stopped) {
          Optional<String> stopReason = stopReason(options, deadline);
          if (stopReason.isPresent()) {
            stopped = true;
            log.warn("Build {} stops scheduling: {}; waiting for {} running stages",
                buildId, stopReason.get(), inFlight.size());
          }
        }
        while (!stopped && !ready.isEmpty() && inFlight.size() < workers) {
          String name = ready.poll();
          StageDescriptor descriptor = graph.descriptor(name);
          Optional<String> failedDependency = firstDependency(descriptor, runs, RunOutcome::failsBuild);
          if (failedDependency.isPresent()) {
            finish(blocked(descriptor, buildId, failedDependency.get()), runs, outputs, graph, waitingOn, ready);
            continue;
          }
          Map<String, Fingerprint> upstream = new TreeMap<>();
          for (String dependency : descriptor.dependencies()) {
            upstream.put(dependency, outputs.get(dependency));
          }
          Fingerprint input = Fingerprints.forInputs(name, descriptor.version(), upstream);
          Optional<StageRun> latest = history.latest(name);
          StalenessReason reason = evaluator.evaluate(descriptor, options.isForced(name), latest, input);
          if (!reason.isStale()) {
            finish(skipped(descriptor, buildId, input, latest.get()), runs, outputs, graph, waitingOn, ready);
            continue;
          }
          if (evaluator.versionChanged(descriptor, latest)) {
            int evicted = cache.evictTag(name);
            log.info("Stage {} version changed to {}; evicted {} cache entries", name, descriptor.version(), evicted);
          }
          Stage stage = graph.stage(name).orElseThrow();
          Future<StageRun> future = completions.submit(() -> runner.execute(stage, buildId, reason, input));
          inFlight.put(future, name);
        }
        if (inFlight.isEmpty()) {
          break;
        }
        Future<StageRun> done;
        try {
          done = completions.poll(POLL_MILLIS, TimeUnit.MILLISECONDS);
        } catch (InterruptedException ex) {
          interrupted = true;
          stopped = true;
          log.warn("Build {} interrupted; cancelling running stages", buildId);
          pool.shutdownNow();
          continue;
        }
        if (done == null) {
          continue;
        }
        String name = inFlight.remove(done);
        finish(collect(done, graph.descriptor(name), buildId), runs, outputs, graph, waitingOn, ready);
      }
    } finally {
      pool.shutdownNow();
      if (interrupted) {
        Thread.currentThread().interrupt();
      }
    }

    // Never started: blocked behind a failure, otherwise cancelled by the stop.
    for (String name : order) {
      if (!runs.containsKey(name)) {
        StageDescriptor descriptor = graph.descriptor(name);
        Optional<String> failedDependency = firstDependency(descriptor, runs,
            outcome -> outcome == RunOutcome.FAILED || outcome == RunOutcome.BLOCKED);
        StageRun run = failedDependency.isPresent()
            ? blocked(descriptor, buildId, failedDependency.get())
            : cancelled(descriptor, buildId);
        finish(run, runs, outputs, graph, waitingOn, ready);
      }
    }
    return runs;
  }

  private static Optional<String> firstDependency(
      StageDescriptor descriptor, Map<String, StageRun> runs, Predicate<RunOutcome> matching) {
    return descriptor.dependencies().stream()
        .filter(dependency -> runs.containsKey(dependency) && matching.test(runs.get(dependency).outcome()))
        .findFirst();
  }

  private Optional<String> stopReason(BuildOptions options, Optional<Instant> deadline) {
    if (options.abort().isAborted()) {
      return options.abort().reason();
    }
    if (deadline.isPresent() && !clock.now().isBefore(deadline.get())) {
      return Optional.of("timeout of " + options.timeout().orElseThrow().toSeconds() + "s reached");
    }
    return Optional.empty();
  }

  private StageRun collect(Future<StageRun> done, StageDescriptor descriptor, String buildId) {
    try {
      return done.get();
    } catch (ExecutionException ex) {
      log.error("Stage {} worker failed", descriptor.name(), ex.getCause());
      Instant now = clock.now();
      return new StageRun(buildId, descriptor.name(), descriptor.version(), now, now, RunOutcome.FAILED,
          StalenessReason.NOT_EVALUATED,
          Optional.of(StageFailure.of(StageErrorKind.UNEXPECTED, "worker failed", ex.getCause())),
          Optional.empty(), Optional.empty(), Optional.empty(), RunStats.EMPTY, CommitSummary.EMPTY);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      return cancelled(descriptor, buildId);
    }
  }

  private void finish(
      StageRun run,
      Map<String, StageRun> runs,
      Map<String, Fingerprint> outputs,
      DependencyGraph graph,
      Map<String, Integer> waitingOn,
      PriorityQueue<String> ready) {
    runs.put(run.stage(), run);
    run.outputFingerprint().ifPresent(fp -> outputs.put(run.stage(), fp));
    metrics.increment("build.stage." + run.outcome().name().toLowerCase(Locale.ROOT));
    if (run.outcome() == RunOutcome.SUCCESS || run.outcome() == RunOutcome.FAILED) {
      metrics.observe("build.stage.duration.ms", run.duration().toMillis());
    }
    if (run.outcome() == RunOutcome.SUCCESS) {
      metrics.observe("store.commit.records", run.commit().total());
    }
    try {
      history.record(run);
    } catch (IOException ex) {
      log.error("Failed to record run of stage {} in history", run.stage(), ex);
    }
    log.info("Stage {} -> {} ({}){}", run.stage(), run.outcome(), run.reason(),
        run.failure().map(failure -> ": " + failure).orElse(""));
    for (String dependent : graph.dependents(run.stage())) {
      if (waitingOn.merge(dependent, -1, Integer::sum) == 0) {
        ready.add(dependent);
      }
    }
  }

  private StageRun skipped(StageDescriptor descriptor, String buildId, Fingerprint input, StageRun previous) {
    Fingerprint output = previous.outputFingerprint().orElseGet(() -> runner.currentFingerprint(descriptor));
    Instant now = clock.now();
    return new StageRun(buildId, descriptor.name(), descriptor.version(), now, now, RunOutcome.SKIPPED_CACHED,
        StalenessReason.UP_TO_DATE, Optional.empty(), Optional.empty(), Optional.of(input), Optional.of(output),
        RunStats.EMPTY, CommitSummary.EMPTY);
  }

  private StageRun blocked(StageDescriptor descriptor, String buildId, String upstream) {
    Instant now = clock.now();
    return new StageRun(buildId, descriptor.name(), descriptor.version(), now, now, RunOutcome.BLOCKED,
        StalenessReason.NOT_EVALUATED, Optional.empty(), Optional.of(upstream), Optional.empty(),
        Optional.empty(), RunStats.EMPTY, CommitSummary.EMPTY);
  }

  private StageRun cancelled(StageDescriptor descriptor, String buildId) {
    Instant now = clock.now();
    return new StageRun(buildId, descriptor.name(), descriptor.version(), now, now, RunOutcome.CANCELLED,
        StalenessReason.NOT_EVALUATED, Optional.empty(), Optional.empty(), Optional.empty(),
        Optional.empty(), RunStats.EMPTY, CommitSummary.EMPTY);
  }
}
