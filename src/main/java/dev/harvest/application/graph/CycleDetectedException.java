package dev.harvest.application.graph;

import java.util.List;

/**
 * Raised when stage dependencies form a cycle.
 *
 * @since 0.1.0
 */
public class CycleDetectedException extends GraphException {
  private static final long serialVersionUID = 1L;

  private final List<String> cycle;

  /**
   * Creates the exception.
   *
   * @param cycle stage names along the cycle, first name repeated at the end
   */
  public CycleDetectedException(List<String> cycle) {
    super("dependency cycle detected: " + String.join(" -> ", cycle));
    this.cycle = List.copyOf(cycle);
  }

  public List<String> cycle() {
    return cycle;
  }
}
