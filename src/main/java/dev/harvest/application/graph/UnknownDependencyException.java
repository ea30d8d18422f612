package dev.harvest.application.graph;

/**
 * Raised when a stage depends on a stage that was never registered.
 *
 * @since 0.1.0
 */
public class UnknownDependencyException extends GraphException {
  private static final long serialVersionUID = 1L;

  private final String stage;
  private final String dependency;

  public UnknownDependencyException(String stage, String dependency) {
    super("stage " + stage + " depends on unknown stage " + dependency);
    this.stage = stage;
    this.dependency = dependency;
  }

  public String stage() {
    return stage;
  }

  public String dependency() {
    return dependency;
  }
}
