package dev.harvest.application.pipeline;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.harvest.application.cache.Fingerprints;
import dev.harvest.application.cache.FetchedPayload;
import dev.harvest.application.cache.ResilientCache;
import dev.harvest.application.graph.DependencyGraph;
import dev.harvest.application.graph.GraphException;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.cache.FetchRequest;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.domain.run.RunOutcome;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.run.StageFailure;
import dev.harvest.domain.run.StageRun;
import dev.harvest.domain.run.StalenessReason;
import dev.harvest.domain.stage.RefreshPolicy;
import dev.harvest.domain.stage.StageDescriptor;
import dev.harvest.infrastructure.cache.InMemoryCacheAdapter;
import dev.harvest.infrastructure.exec.ExecutorFactories;
import dev.harvest.infrastructure.history.InMemoryRunHistoryAdapter;
import dev.harvest.infrastructure.store.InMemoryContentStore;
import dev.harvest.support.MutableClock;
import dev.harvest.support.RecordingMetricsPort;
import dev.harvest.support.ScriptedStage;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.stream.Collectors;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class BuildUseCaseTest {
  private static final RecordVariant EVENT = RecordVariant.EVENT;
  private static final RecordVariant POSTING = RecordVariant.POSTING;
  private static final FetchRequest FEED = FetchRequest.of("https://events.example/feed.xml");

  private MutableClock clock;
  private RecordingMetricsPort metrics;
  private InMemoryContentStore store;
  private InMemoryCacheAdapter cacheBacking;
  private InMemoryRunHistoryAdapter history;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-05-01T08:00:00Z");
    metrics = new RecordingMetricsPort();
    store = new InMemoryContentStore(clock);
    cacheBacking = new InMemoryCacheAdapter(clock);
    history = new InMemoryRunHistoryAdapter();
  }

  @Test
  void secondBuildWithoutChangesSkipsEveryStage() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup", "talk"));
    ScriptedStage source = eventSource("events", RefreshPolicy.ON_INPUT_CHANGE, events);
    ScriptedStage postings = postingsFrom("postings", "events");
    DependencyGraph graph = graph(source, postings);

    BuildReport first = build(graph, BuildOptions.defaults());
    BuildReport second = build(graph, BuildOptions.defaults());

    assertTrue(first.succeeded());
    assertEquals(StalenessReason.NEVER_RUN, first.run("events").orElseThrow().reason());
    assertEquals(RunOutcome.SKIPPED_CACHED, second.outcome("events"));
    assertEquals(RunOutcome.SKIPPED_CACHED, second.outcome("postings"));
    assertEquals(1, source.runs());
    assertEquals(1, postings.runs());
    assertEquals(VariantStatus.CARRIED_OVER, second.variantStatuses().get(EVENT));
    assertEquals(VariantStatus.CARRIED_OVER, store.status(POSTING));
    assertEquals(2, store.query(POSTING, record -> true).size());
    assertTrue(second.succeeded());
  }

  @Test
  void everyBuildSourceWithUnchangedOutputLetsDependentsSkip() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup", "talk"));
    ScriptedStage source = eventSource("events", RefreshPolicy.EVERY_BUILD, events);
    ScriptedStage postings = postingsFrom("postings", "events");
    DependencyGraph graph = graph(source, postings);

    build(graph, BuildOptions.defaults());
    BuildReport second = build(graph, BuildOptions.defaults());

    assertEquals(RunOutcome.SUCCESS, second.outcome("events"));
    assertEquals(StalenessReason.EVERY_BUILD, second.run("events").orElseThrow().reason());
    assertEquals(RunOutcome.SKIPPED_CACHED, second.outcome("postings"));
    assertEquals(1, postings.runs());
    assertEquals(VariantStatus.FRESH, second.variantStatuses().get(EVENT));
    assertEquals(VariantStatus.CARRIED_OVER, second.variantStatuses().get(POSTING));
    assertEquals(0, second.pruned().get(EVENT));
  }

  @Test
  void changedSourceRerunsDependentsAndPrunesRemovedRecords() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup", "talk"));
    ScriptedStage source = eventSource("events", RefreshPolicy.EVERY_BUILD, events);
    ScriptedStage postings = postingsFrom("postings", "events");
    DependencyGraph graph = graph(source, postings);

    build(graph, BuildOptions.defaults());
    events.remove("talk");
    BuildReport second = build(graph, BuildOptions.defaults());

    assertEquals(RunOutcome.SUCCESS, second.outcome("postings"));
    assertEquals(StalenessReason.UPSTREAM_CHANGED, second.run("postings").orElseThrow().reason());
    assertEquals(1, second.pruned().get(EVENT));
    assertEquals(1, second.pruned().get(POSTING));
    assertEquals(Set.of("meetup"), keys(EVENT));
    assertEquals(Set.of("posting-meetup"), keys(POSTING));
    assertEquals(VariantStatus.FRESH, store.status(POSTING));
  }

  @Test
  void dependentSeesOnlyRecordsAffirmedInTheCurrentBuild() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup", "talk"));
    ScriptedStage source = eventSource("events", RefreshPolicy.EVERY_BUILD, events);
    List<Set<String>> seenByDependent = new CopyOnWriteArrayList<>();
    ScriptedStage reader = new ScriptedStage(
        StageDescriptor.builder("reader").dependsOn("events").build(),
        (cache, tx) -> {
          seenByDependent.add(tx.query(EVENT, record -> true).stream()
              .map(ContentRecord::naturalKey)
              .collect(Collectors.toCollection(TreeSet::new)));
          return StageResult.ok(0);
        });
    DependencyGraph graph = graph(source, reader);

    build(graph, BuildOptions.defaults());
    events.remove("talk");
    build(graph, BuildOptions.defaults());

    assertEquals(List.of(Set.of("meetup", "talk"), Set.of("meetup")), seenByDependent);
  }

  @Test
  void versionBumpEvictsOnlyThatStagesCacheEntries() throws Exception {
    AtomicInteger fetches = new AtomicInteger();
    ScriptedStage.Body fetching = (cache, tx) -> {
      try {
        cache.fetch(FEED, () -> {
          fetches.incrementAndGet();
          return new FetchedPayload("<rss/>".getBytes(StandardCharsets.UTF_8), "application/rss+xml");
        });
      } catch (IOException ex) {
        return StageResult.failed(StageErrorKind.FETCH, "fetch failed", ex);
      }
      return StageResult.ok(1);
    };
    DependencyGraph first = graph(
        new ScriptedStage(StageDescriptor.builder("alpha").version("1").build(), fetching),
        new ScriptedStage(StageDescriptor.builder("beta").version("1").build(), fetching));
    build(first, BuildOptions.defaults());
    assertEquals(2, fetches.get());
    assertEquals(2, cacheBacking.size());

    DependencyGraph bumped = graph(
        new ScriptedStage(StageDescriptor.builder("alpha").version("2").build(), fetching),
        new ScriptedStage(StageDescriptor.builder("beta").version("1").build(), fetching));
    BuildReport report = build(bumped, BuildOptions.defaults());

    assertEquals(StalenessReason.VERSION_CHANGED, report.run("alpha").orElseThrow().reason());
    assertEquals(RunOutcome.SKIPPED_CACHED, report.outcome("beta"));
    assertEquals(3, fetches.get());
    assertTrue(cacheBacking.get(Fingerprints.forRequest("alpha", "1", FEED)).isEmpty());
    assertTrue(cacheBacking.get(Fingerprints.forRequest("alpha", "2", FEED)).isPresent());
    assertEquals(1, cacheBacking.evictTag("beta"));
  }

  @Test
  void failureBlocksDependentsWhileIndependentBranchSucceeds() throws Exception {
    ScriptedStage broken = new ScriptedStage(StageDescriptor.builder("events").build(),
        (cache, tx) -> StageResult.failed(StageErrorKind.FETCH, "feed returned 503"));
    ScriptedStage postings = ScriptedStage.noop(StageDescriptor.builder("postings").dependsOn("events").build());
    ScriptedStage publish = ScriptedStage.noop(StageDescriptor.builder("publish").dependsOn("postings").build());
    ScriptedStage orgs = ScriptedStage.noop(StageDescriptor.builder("orgs").build());

    BuildReport report = build(graph(broken, postings, publish, orgs), BuildOptions.defaults());

    assertFalse(report.succeeded());
    assertEquals(RunOutcome.FAILED, report.outcome("events"));
    assertEquals(StageErrorKind.FETCH, report.run("events").orElseThrow().failure().orElseThrow().kind());
    assertEquals(RunOutcome.BLOCKED, report.outcome("postings"));
    assertEquals("events", report.run("postings").orElseThrow().blockedBy().orElseThrow());
    assertEquals(RunOutcome.BLOCKED, report.outcome("publish"));
    assertEquals("postings", report.run("publish").orElseThrow().blockedBy().orElseThrow());
    assertEquals(RunOutcome.SUCCESS, report.outcome("orgs"));
    assertEquals(0, postings.runs());
    assertEquals(3, report.failures().size());
  }

  @Test
  void failedStageKeepsPreviousRecordsAndMarksVariantPartial() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup", "talk"));
    ScriptedStage source = eventSource("events", RefreshPolicy.EVERY_BUILD, events);
    DependencyGraph graph = graph(source);
    build(graph, BuildOptions.defaults());

    source.body((cache, tx) -> {
      tx.upsert(EVENT, "workshop", Map.of("title", "workshop"));
      return StageResult.failed(StageErrorKind.TRANSFORM, "malformed entry");
    });
    BuildReport report = build(graph, BuildOptions.defaults());

    assertEquals(RunOutcome.FAILED, report.outcome("events"));
    assertEquals(VariantStatus.PARTIAL, report.variantStatuses().get(EVENT));
    assertFalse(report.pruned().containsKey(EVENT));
    assertEquals(Set.of("meetup", "talk"), keys(EVENT));
  }

  @Test
  void writeOutsideOwnedVariantsIsAnOwnershipConflict() throws Exception {
    ScriptedStage rogue = new ScriptedStage(StageDescriptor.builder("rogue").owns(POSTING).build(),
        (cache, tx) -> {
          tx.upsert(POSTING, "ok", Map.of("title", "fine"));
          tx.upsert(EVENT, "not-mine", Map.of("title", "nope"));
          return StageResult.ok(2);
        });

    BuildReport report = build(graph(rogue), BuildOptions.defaults());

    StageFailure failure = report.run("rogue").orElseThrow().failure().orElseThrow();
    assertEquals(StageErrorKind.OWNERSHIP_CONFLICT, failure.kind());
    assertTrue(failure.message().contains("event"));
    assertTrue(store.query(POSTING, record -> true).isEmpty());
  }

  @Test
  void unexpectedExceptionIsCapturedAsFailure() throws Exception {
    ScriptedStage crashing = new ScriptedStage(StageDescriptor.builder("crashing").build(),
        (cache, tx) -> {
          throw new IllegalStateException("parser state corrupted");
        });

    BuildReport report = build(graph(crashing), BuildOptions.defaults());

    StageFailure failure = report.run("crashing").orElseThrow().failure().orElseThrow();
    assertEquals(StageErrorKind.UNEXPECTED, failure.kind());
    assertTrue(failure.message().contains("parser state corrupted"));
    assertEquals(IllegalStateException.class.getName(), failure.causeType());
  }

  @Test
  void nullResultIsTreatedAsUnexpected() throws Exception {
    ScriptedStage silent = new ScriptedStage(StageDescriptor.builder("silent").build(), (cache, tx) -> null);

    BuildReport report = build(graph(silent), BuildOptions.defaults());

    assertEquals(StageErrorKind.UNEXPECTED,
        report.run("silent").orElseThrow().failure().orElseThrow().kind());
  }

  @Test
  void longFailureMessagesAreTruncated() throws Exception {
    String detail = "x".repeat(4_000);
    ScriptedStage verbose = new ScriptedStage(StageDescriptor.builder("verbose").build(),
        (cache, tx) -> StageResult.failed(StageErrorKind.TRANSFORM, detail));

    BuildReport report = build(graph(verbose), BuildOptions.defaults());

    String message = report.run("verbose").orElseThrow().failure().orElseThrow().message();
    assertTrue(message.startsWith("xxxx"));
    assertTrue(message.contains("truncated"));
    assertTrue(message.length() < 600, "message length " + message.length());
  }

  @Test
  void forceRerunsOnlyTheNamedStage() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup"));
    ScriptedStage source = eventSource("events", RefreshPolicy.ON_INPUT_CHANGE, events);
    ScriptedStage postings = postingsFrom("postings", "events");
    ScriptedStage publish = ScriptedStage.noop(StageDescriptor.builder("publish").dependsOn("postings").build());
    DependencyGraph graph = graph(source, postings, publish);
    build(graph, BuildOptions.defaults());

    BuildReport report = build(graph, BuildOptions.builder().force("postings").build());

    assertEquals(RunOutcome.SKIPPED_CACHED, report.outcome("events"));
    assertEquals(StalenessReason.FORCED, report.run("postings").orElseThrow().reason());
    assertEquals(2, postings.runs());
    assertEquals(RunOutcome.SKIPPED_CACHED, report.outcome("publish"));
    assertEquals(1, publish.runs());
  }

  @Test
  void forceAllRerunsEverything() throws Exception {
    ScriptedStage a = ScriptedStage.noop(StageDescriptor.builder("a").build());
    ScriptedStage b = ScriptedStage.noop(StageDescriptor.builder("b").dependsOn("a").build());
    DependencyGraph graph = graph(a, b);
    build(graph, BuildOptions.defaults());

    BuildReport report = build(graph, BuildOptions.builder().forceAll(true).build());

    assertEquals(StalenessReason.FORCED, report.run("a").orElseThrow().reason());
    assertEquals(StalenessReason.FORCED, report.run("b").orElseThrow().reason());
    assertEquals(2, b.runs());
  }

  @Test
  void previouslyFailedStageRunsAgain() throws Exception {
    ScriptedStage flaky = new ScriptedStage(StageDescriptor.builder("flaky").build(),
        (cache, tx) -> StageResult.failed(StageErrorKind.FETCH, "timeout"));
    ScriptedStage after = ScriptedStage.noop(StageDescriptor.builder("after").dependsOn("flaky").build());
    DependencyGraph graph = graph(flaky, after);
    build(graph, BuildOptions.defaults());

    flaky.body((cache, tx) -> StageResult.ok(0));
    BuildReport report = build(graph, BuildOptions.defaults());

    assertTrue(report.succeeded());
    assertEquals(StalenessReason.PREVIOUS_RUN_INCOMPLETE, report.run("flaky").orElseThrow().reason());
    assertEquals(StalenessReason.PREVIOUS_RUN_INCOMPLETE, report.run("after").orElseThrow().reason());
  }

  @Test
  void timeoutCancelsStagesThatHaveNotStarted() throws Exception {
    ScriptedStage slow = new ScriptedStage(StageDescriptor.builder("a").build(), (cache, tx) -> {
      clock.advance(Duration.ofMinutes(2));
      return StageResult.ok(0);
    });
    ScriptedStage pending = ScriptedStage.noop(StageDescriptor.builder("b").build());

    BuildReport report = build(graph(slow, pending),
        BuildOptions.builder().timeout(Duration.ofMinutes(1)).build(), 1);

    assertEquals(RunOutcome.SUCCESS, report.outcome("a"));
    assertEquals(RunOutcome.CANCELLED, report.outcome("b"));
    assertEquals(0, pending.runs());
    assertFalse(report.succeeded());
  }

  @Test
  void abortSignalStopsScheduling() throws Exception {
    AbortSignal abort = new AbortSignal();
    ScriptedStage first = new ScriptedStage(StageDescriptor.builder("a").build(), (cache, tx) -> {
      abort.abort("operator requested shutdown");
      return StageResult.ok(0);
    });
    ScriptedStage second = ScriptedStage.noop(StageDescriptor.builder("b").dependsOn("a").build());

    BuildReport report = build(graph(first, second), BuildOptions.builder().abort(abort).build());

    assertEquals(RunOutcome.SUCCESS, report.outcome("a"));
    assertEquals(RunOutcome.CANCELLED, report.outcome("b"));
    assertEquals(RunOutcome.CANCELLED, history.latest("b").orElseThrow().outcome());
  }

  @Test
  void dependentsOfFailedStageStayBlockedWhenBuildStops() throws Exception {
    AbortSignal abort = new AbortSignal();
    ScriptedStage failing = new ScriptedStage(StageDescriptor.builder("a").build(), (cache, tx) -> {
      abort.abort("operator requested shutdown");
      return StageResult.failed(StageErrorKind.FETCH, "feed unreachable");
    });
    ScriptedStage dependent = ScriptedStage.noop(StageDescriptor.builder("b").dependsOn("a").build());
    ScriptedStage downstream = ScriptedStage.noop(StageDescriptor.builder("d").dependsOn("b").build());
    ScriptedStage independent = ScriptedStage.noop(StageDescriptor.builder("c").build());

    BuildReport report = build(graph(failing, dependent, downstream, independent),
        BuildOptions.builder().abort(abort).build(), 1);

    assertEquals(RunOutcome.FAILED, report.outcome("a"));
    assertEquals(RunOutcome.BLOCKED, report.outcome("b"));
    assertEquals("a", report.run("b").orElseThrow().blockedBy().orElseThrow());
    assertEquals(RunOutcome.BLOCKED, report.outcome("d"));
    assertEquals("b", report.run("d").orElseThrow().blockedBy().orElseThrow());
    assertEquals(RunOutcome.CANCELLED, report.outcome("c"));
    assertEquals(RunOutcome.BLOCKED, history.latest("b").orElseThrow().outcome());
    assertEquals(0, dependent.runs());
    assertEquals(0, independent.runs());
  }

  @Test
  void forcingUnknownStageIsRejectedBeforeAnythingRuns() throws Exception {
    ScriptedStage source = ScriptedStage.noop(StageDescriptor.builder("fetch_feeds").build());
    DependencyGraph graph = graph(source);

    IllegalArgumentException ex = assertThrows(IllegalArgumentException.class,
        () -> build(graph, BuildOptions.builder().force("fetch_feed").build()));
    assertThrows(IllegalArgumentException.class,
        () -> build(graph, BuildOptions.builder().force("fetch_feed").dryRun(true).build()));

    assertTrue(ex.getMessage().contains("fetch_feed"), ex.getMessage());
    assertEquals(0, source.runs());
    assertTrue(history.all().isEmpty());
  }

  @Test
  void interruptedStageIsCancelledAndRolledBack() throws Exception {
    ScriptedStage interrupted = new ScriptedStage(
        StageDescriptor.builder("events").owns(EVENT).build(), (cache, tx) -> {
          tx.upsert(EVENT, "half-written", Map.of("title", "x"));
          throw new InterruptedException("shutdown");
        });
    ScriptedStage after = ScriptedStage.noop(StageDescriptor.builder("after").dependsOn("events").build());

    BuildReport report = build(graph(interrupted, after), BuildOptions.defaults());

    assertEquals(RunOutcome.CANCELLED, report.outcome("events"));
    assertEquals(RunOutcome.BLOCKED, report.outcome("after"));
    assertTrue(store.query(EVENT, record -> true).isEmpty());
    assertEquals(VariantStatus.PARTIAL, report.variantStatuses().get(EVENT));
  }

  @Test
  void independentStagesRunConcurrently() throws Exception {
    CountDownLatch bothStarted = new CountDownLatch(2);
    ScriptedStage.Body rendezvous = (cache, tx) -> {
      bothStarted.countDown();
      return bothStarted.await(5, TimeUnit.SECONDS)
          ? StageResult.ok(0)
          : StageResult.failed(StageErrorKind.UNEXPECTED, "stages did not overlap");
    };

    BuildReport report = build(graph(
        new ScriptedStage(StageDescriptor.builder("left").build(), rendezvous),
        new ScriptedStage(StageDescriptor.builder("right").build(), rendezvous)),
        BuildOptions.defaults(), 2);

    assertTrue(report.succeeded(), () -> String.valueOf(report.failures()));
  }

  @Test
  void dependentsStartOnlyAfterTheirDependenciesFinish() throws Exception {
    List<String> started = new CopyOnWriteArrayList<>();
    List<Stage> stages = new ArrayList<>();
    for (String[] edge : new String[][] {{"fetch"}, {"parse", "fetch"}, {"index", "parse"}, {"report", "parse"}}) {
      StageDescriptor.Builder builder = StageDescriptor.builder(edge[0]);
      if (edge.length > 1) {
        builder.dependsOn(edge[1]);
      }
      String name = edge[0];
      stages.add(new ScriptedStage(builder.build(), (cache, tx) -> {
        started.add(name);
        return StageResult.ok(0);
      }));
    }

    build(graph(stages.toArray(new Stage[0])), BuildOptions.defaults(), 4);

    assertEquals("fetch", started.get(0));
    assertEquals("parse", started.get(1));
    assertEquals(Set.of("index", "report"), Set.copyOf(started.subList(2, 4)));
  }

  @Test
  void dryRunPredictsWithoutRunningAnything() throws Exception {
    List<String> events = new CopyOnWriteArrayList<>(List.of("meetup"));
    DependencyGraph first = graph(
        eventSource("events", RefreshPolicy.EVERY_BUILD, events),
        postingsFrom("postings", "events"),
        ScriptedStage.noop(StageDescriptor.builder("orgs").version("1").build()),
        ScriptedStage.noop(StageDescriptor.builder("members").build()));
    build(first, BuildOptions.defaults());
    int recorded = history.all().size();

    ScriptedStage source = eventSource("events", RefreshPolicy.EVERY_BUILD, events);
    ScriptedStage postings = postingsFrom("postings", "events");
    ScriptedStage orgs = ScriptedStage.noop(StageDescriptor.builder("orgs").version("2").build());
    ScriptedStage members = ScriptedStage.noop(StageDescriptor.builder("members").build());
    BuildReport report = build(graph(source, postings, orgs, members), BuildOptions.builder().dryRun(true).build());

    assertTrue(report.isDryRun());
    assertTrue(report.runs().isEmpty());
    ExecutionPlan plan = report.plan().orElseThrow();
    assertEquals(PlanEntry.Action.RUN, plan.entry("events").orElseThrow().action());
    assertEquals(StalenessReason.EVERY_BUILD, plan.entry("events").orElseThrow().reason());
    assertEquals(PlanEntry.Action.RUN_IF_UPSTREAM_CHANGES, plan.entry("postings").orElseThrow().action());
    assertEquals(PlanEntry.Action.RUN, plan.entry("orgs").orElseThrow().action());
    assertEquals(StalenessReason.VERSION_CHANGED, plan.entry("orgs").orElseThrow().reason());
    assertEquals(PlanEntry.Action.SKIP, plan.entry("members").orElseThrow().action());
    assertEquals(0, source.runs() + postings.runs() + orgs.runs() + members.runs());
    assertEquals(recorded, history.all().size());
    assertFalse(store.buildOpen());
  }

  @Test
  void clearCacheEvictsNamedTagsBeforeRunning() throws Exception {
    AtomicInteger fetches = new AtomicInteger();
    ScriptedStage fetching = new ScriptedStage(
        StageDescriptor.builder("events").refreshPolicy(RefreshPolicy.EVERY_BUILD).build(), (cache, tx) -> {
          try {
            cache.fetch(FEED, () -> {
              fetches.incrementAndGet();
              return new FetchedPayload(new byte[] {1}, "application/octet-stream");
            });
          } catch (IOException ex) {
            return StageResult.failed(StageErrorKind.FETCH, "fetch failed", ex);
          }
          return StageResult.ok(1);
        });
    DependencyGraph graph = graph(fetching);

    build(graph, BuildOptions.defaults());
    build(graph, BuildOptions.defaults());
    assertEquals(1, fetches.get());
    build(graph, BuildOptions.builder().clearCache(List.of("events")).build());

    assertEquals(2, fetches.get());
  }

  @Test
  void metricsCountOutcomesAndDurations() throws Exception {
    ScriptedStage ok = ScriptedStage.noop(StageDescriptor.builder("ok").build());
    ScriptedStage broken = new ScriptedStage(StageDescriptor.builder("broken").build(),
        (cache, tx) -> StageResult.failed(StageErrorKind.FETCH, "no route to host"));
    ScriptedStage blocked = ScriptedStage.noop(StageDescriptor.builder("downstream").dependsOn("broken").build());

    build(graph(ok, broken, blocked), BuildOptions.defaults());

    assertEquals(1, metrics.count("build.stage.success"));
    assertEquals(1, metrics.count("build.stage.failed"));
    assertEquals(1, metrics.count("build.stage.blocked"));
    assertEquals(2, metrics.observed("build.stage.duration.ms").size());
    assertEquals(1, metrics.observed("store.commit.records").size());
  }

  @Test
  void everyRunIsRecordedInHistory() throws Exception {
    ScriptedStage a = ScriptedStage.noop(StageDescriptor.builder("a").build());
    ScriptedStage b = ScriptedStage.noop(StageDescriptor.builder("b").dependsOn("a").build());
    DependencyGraph graph = graph(a, b);

    BuildReport first = build(graph, BuildOptions.defaults());
    build(graph, BuildOptions.defaults());

    assertEquals(4, history.all().size());
    StageRun latest = history.latest("b").orElseThrow();
    assertEquals(RunOutcome.SKIPPED_CACHED, latest.outcome());
    assertEquals(first.run("b").orElseThrow().outputFingerprint(), latest.outputFingerprint());
  }

  @Test
  void graphWithoutImplementationsCannotRun() throws Exception {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("planned").build());

    assertThrows(IllegalArgumentException.class, () -> build(graph, BuildOptions.defaults()));
    assertFalse(store.buildOpen());
  }

  @Test
  void cyclicGraphIsRejectedBeforeAnythingRuns() throws Exception {
    ScriptedStage a = ScriptedStage.noop(StageDescriptor.builder("a").dependsOn("b").build());
    ScriptedStage b = ScriptedStage.noop(StageDescriptor.builder("b").dependsOn("a").build());
    DependencyGraph graph = new DependencyGraph();
    graph.register(a);
    graph.register(b);

    assertThrows(GraphException.class, () -> build(graph, BuildOptions.defaults()));
    assertEquals(0, a.runs() + b.runs());
    assertTrue(history.all().isEmpty());
  }

  private BuildReport build(DependencyGraph graph, BuildOptions options) throws Exception {
    return build(graph, options, 4);
  }

  private BuildReport build(DependencyGraph graph, BuildOptions options, int workers) throws Exception {
    clock.advance(Duration.ofSeconds(1));
    BuildUseCase useCase = new BuildUseCase(store, new ResilientCache(cacheBacking, metrics), history, clock,
        metrics, workers, Duration.ofHours(1), ExecutorFactories.stagePools());
    return useCase.run(graph, options);
  }

  private static DependencyGraph graph(Stage... stages) throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    for (Stage stage : stages) {
      graph.register(stage);
    }
    return graph;
  }

  private Set<String> keys(RecordVariant variant) {
    return store.query(variant, record -> true).stream()
        .map(ContentRecord::naturalKey)
        .collect(Collectors.toCollection(TreeSet::new));
  }

  private static ScriptedStage eventSource(String name, RefreshPolicy policy, List<String> events) {
    return new ScriptedStage(
        StageDescriptor.builder(name).owns(EVENT).refreshPolicy(policy).build(),
        (cache, tx) -> {
          for (String event : events) {
            tx.upsert(EVENT, event, Map.of("title", event));
          }
          return StageResult.ok(events.size());
        });
  }

  private static ScriptedStage postingsFrom(String name, String upstream) {
    return new ScriptedStage(
        StageDescriptor.builder(name).dependsOn(upstream).owns(POSTING).build(),
        (cache, tx) -> {
          List<ContentRecord> events = tx.query(EVENT, record -> true);
          for (ContentRecord event : events) {
            tx.upsert(POSTING, "posting-" + event.naturalKey(), Map.of("title", event.text("title")));
          }
          return StageResult.ok(events.size());
        });
  }
}
