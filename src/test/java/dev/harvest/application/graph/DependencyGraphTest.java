package dev.harvest.application.graph;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.stage.StageDescriptor;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class DependencyGraphTest {

  @Test
  void ordersStagesAfterTheirDependencies() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("publish").dependsOn("postings", "orgs").build());
    graph.register(StageDescriptor.builder("postings").dependsOn("fetch").build());
    graph.register(StageDescriptor.builder("orgs").build());
    graph.register(StageDescriptor.builder("fetch").build());

    List<String> order = graph.topologicalOrder();

    assertEquals(4, order.size());
    assertTrue(order.indexOf("fetch") < order.indexOf("postings"));
    assertTrue(order.indexOf("postings") < order.indexOf("publish"));
    assertTrue(order.indexOf("orgs") < order.indexOf("publish"));
    assertTrue(graph.isValidated());
  }

  @Test
  void unknownDependencyIsRejected() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("postings").dependsOn("fetch").build());

    UnknownDependencyException ex = assertThrows(UnknownDependencyException.class, graph::validate);
    assertEquals("postings", ex.stage());
    assertEquals("fetch", ex.dependency());
    assertFalse(graph.isValidated());
  }

  @Test
  void cycleIsReportedWithItsMembers() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("a").dependsOn("c").build());
    graph.register(StageDescriptor.builder("b").dependsOn("a").build());
    graph.register(StageDescriptor.builder("c").dependsOn("b").build());
    graph.register(StageDescriptor.builder("d").build());

    CycleDetectedException ex = assertThrows(CycleDetectedException.class, graph::topologicalOrder);
    assertTrue(ex.cycle().containsAll(List.of("a", "b", "c")));
    assertFalse(ex.cycle().contains("d"));
  }

  @Test
  void selfDependencyFailsAtRegistration() {
    DependencyGraph graph = new DependencyGraph();
    assertThrows(CycleDetectedException.class,
        () -> graph.register(StageDescriptor.builder("loop").dependsOn("loop").build()));
  }

  @Test
  void duplicateNamesAndSharedVariantsAreRejected() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("postings").owns(RecordVariant.POSTING).build());

    assertThrows(DuplicateStageException.class,
        () -> graph.register(StageDescriptor.builder("postings").build()));
    OwnershipConflictException conflict = assertThrows(OwnershipConflictException.class,
        () -> graph.register(StageDescriptor.builder("rival").owns(RecordVariant.POSTING).build()));
    assertEquals("postings", conflict.owner());
    assertEquals("rival", conflict.claimant());
    assertEquals(Map.of(RecordVariant.POSTING, "postings"), graph.owners());
  }

  @Test
  void sealedGraphRefusesRegistration() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("fetch").build());
    graph.validate();

    assertThrows(IllegalStateException.class, () -> graph.register(StageDescriptor.builder("late").build()));
  }

  @Test
  void dependentsListDirectDownstreamStagesOnly() throws GraphException {
    DependencyGraph graph = new DependencyGraph();
    graph.register(StageDescriptor.builder("fetch").build());
    graph.register(StageDescriptor.builder("postings").dependsOn("fetch").build());
    graph.register(StageDescriptor.builder("events").dependsOn("fetch").build());
    graph.register(StageDescriptor.builder("publish").dependsOn("postings", "events").build());

    assertEquals(List.of("events", "postings"), graph.dependents("fetch").stream().sorted().toList());
    assertEquals(List.of("publish"), graph.dependents("events"));
  }
}
