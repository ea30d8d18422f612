package dev.harvest.application.graph;

import dev.harvest.application.port.stage.Stage;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.stage.StageDescriptor;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.PriorityQueue;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

/**
 * <strong>What:</strong> Registry of stage descriptors and their dependency edges.
 * <p><strong>Why:</strong> The scheduler needs a validated DAG and a reproducible execution order.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reject duplicate names, self-dependencies and conflicting variant ownership on registration.</li>
 *   <li>Reject unknown dependencies and cycles on validation.</li>
 *   <li>Produce a topological order with ties broken by stage name.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Registration is synchronized; after {@link #validate()} the graph
 * is sealed and all reads are safe from any thread.</p>
 *
 * @since 0.1.0
 */
public final class DependencyGraph {
  private final Map<String, StageDescriptor> descriptors = new TreeMap<>();
  private final Map<String, Stage> plugins = new HashMap<>();
  private final Map<RecordVariant, String> owners = new TreeMap<>();
  private volatile List<String> order;

  /**
   * Registers a stage plugin together with its descriptor.
   *
   * @param stage stage plugin
   * @throws GraphException when the descriptor conflicts with registered stages
   */
  public synchronized void register(Stage stage) throws GraphException {
    Objects.requireNonNull(stage, "stage");
    StageDescriptor descriptor = Objects.requireNonNull(stage.descriptor(), "descriptor");
    register(descriptor);
    plugins.put(descriptor.name(), stage);
  }

  /**
   * Registers a descriptor without a run function, e.g. for planning.
   *
   * @param descriptor stage descriptor
   * @throws DuplicateStageException when the name is taken
   * @throws OwnershipConflictException when an owned variant already has an owner
   * @throws CycleDetectedException when the stage depends on itself
   * @throws IllegalStateException when the graph was already validated
   */
  public synchronized void register(StageDescriptor descriptor) throws GraphException {
    Objects.requireNonNull(descriptor, "descriptor");
    if (order != null) {
      throw new IllegalStateException("graph is sealed; cannot register " + descriptor.name());
    }
    String name = descriptor.name();
    if (descriptors.containsKey(name)) {
      throw new DuplicateStageException(name);
    }
    if (descriptor.dependsOn(name)) {
      throw new CycleDetectedException(List.of(name, name));
    }
    for (RecordVariant variant : descriptor.ownedVariants()) {
      String owner = owners.get(variant);
      if (owner != null) {
        throw new OwnershipConflictException(variant, owner, name);
      }
    }
    for (RecordVariant variant : descriptor.ownedVariants()) {
      owners.put(variant, name);
    }
    descriptors.put(name, descriptor);
  }

  /**
   * Checks that every dependency is registered and that the graph is acyclic, then seals it.
   * Repeated calls are no-ops.
   *
   * @throws UnknownDependencyException when an edge points to an unregistered stage
   * @throws CycleDetectedException when the dependencies form a cycle
   */
  public synchronized void validate() throws GraphException {
    if (order != null) {
      return;
    }
    for (StageDescriptor descriptor : descriptors.values()) {
      for (String dependency : descriptor.dependencies()) {
        if (!descriptors.containsKey(dependency)) {
          throw new UnknownDependencyException(descriptor.name(), dependency);
        }
      }
    }
    Optional<List<String>> cycle = findCycle();
    if (cycle.isPresent()) {
      throw new CycleDetectedException(cycle.get());
    }
    order = Collections.unmodifiableList(kahnOrder());
  }

  /**
   * Returns the execution order, validating the graph first when needed.
   *
   * @return stage names such that every stage follows all of its dependencies
   * @throws GraphException when validation fails
   */
  public List<String> topologicalOrder() throws GraphException {
    List<String> current = order;
    if (current == null) {
      validate();
      current = order;
    }
    return current;
  }

  public boolean isValidated() {
    return order != null;
  }

  /**
   * Looks up a registered descriptor.
   *
   * @param name stage name
   * @return descriptor
   * @throws IllegalArgumentException when no such stage exists
   */
  public synchronized StageDescriptor descriptor(String name) {
    StageDescriptor descriptor = descriptors.get(name);
    if (descriptor == null) {
      throw new IllegalArgumentException("unknown stage: " + name);
    }
    return descriptor;
  }

  /**
   * Looks up the plugin registered for a stage.
   *
   * @param name stage name
   * @return plugin, empty when only a descriptor was registered
   */
  public synchronized Optional<Stage> stage(String name) {
    return Optional.ofNullable(plugins.get(name));
  }

  public synchronized boolean contains(String name) {
    return descriptors.containsKey(name);
  }

  public synchronized Set<String> names() {
    return Collections.unmodifiableSet(new TreeSet<>(descriptors.keySet()));
  }

  public synchronized int size() {
    return descriptors.size();
  }

  /**
   * Returns the owner of every claimed record variant.
   *
   * @return variant to owning stage name
   */
  public synchronized Map<RecordVariant, String> owners() {
    return Collections.unmodifiableMap(new TreeMap<>(owners));
  }

  /**
   * Returns the stages that directly depend on {@code name}, sorted by name.
   *
   * @param name upstream stage
   * @return direct dependents
   */
  public synchronized List<String> dependents(String name) {
    List<String> result = new ArrayList<>();
    for (StageDescriptor descriptor : descriptors.values()) {
      if (descriptor.dependsOn(name)) {
        result.add(descriptor.name());
      }
    }
    return result;
  }

  private List<String> kahnOrder() {
    Map<String, Integer> inDegree = new HashMap<>();
    Map<String, List<String>> downstream = new HashMap<>();
    for (StageDescriptor descriptor : descriptors.values()) {
      inDegree.put(descriptor.name(), descriptor.dependencies().size());
      for (String dependency : descriptor.dependencies()) {
        downstream.computeIfAbsent(dependency, key -> new ArrayList<>()).add(descriptor.name());
      }
    }
    PriorityQueue<String> ready = new PriorityQueue<>();
    inDegree.forEach((name, degree) -> {
      if (degree == 0) {
        ready.add(name);
      }
    });
    List<String> result = new ArrayList<>(descriptors.size());
    while (!ready.isEmpty()) {
      String next = ready.poll();
      result.add(next);
      for (String dependent : downstream.getOrDefault(next, List.of())) {
        int remaining = inDegree.merge(dependent, -1, Integer::sum);
        if (remaining == 0) {
          ready.add(dependent);
        }
      }
    }
    return result;
  }

  private Optional<List<String>> findCycle() {
    Map<String, Mark> marks = new HashMap<>();
    for (String name : descriptors.keySet()) {
      if (!marks.containsKey(name)) {
        Deque<String> path = new ArrayDeque<>();
        Optional<List<String>> cycle = visit(name, marks, path);
        if (cycle.isPresent()) {
          return cycle;
        }
      }
    }
    return Optional.empty();
  }

  private Optional<List<String>> visit(String name, Map<String, Mark> marks, Deque<String> path) {
    marks.put(name, Mark.IN_PROGRESS);
    path.addLast(name);
    for (String dependency : new TreeSet<>(descriptors.get(name).dependencies())) {
      Mark mark = marks.get(dependency);
      if (mark == Mark.IN_PROGRESS) {
        List<String> cycle = new ArrayList<>();
        boolean inCycle = false;
        for (String step : path) {
          inCycle |= step.equals(dependency);
          if (inCycle) {
            cycle.add(step);
          }
        }
        cycle.add(dependency);
        return Optional.of(cycle);
      }
      if (mark == null) {
        Optional<List<String>> cycle = visit(dependency, marks, path);
        if (cycle.isPresent()) {
          return cycle;
        }
      }
    }
    path.removeLast();
    marks.put(name, Mark.DONE);
    return Optional.empty();
  }

  private enum Mark {
    IN_PROGRESS,
    DONE
  }
}
