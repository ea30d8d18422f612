package dev.harvest.application.graph;

/**
 * Raised when two stages register under the same name.
 *
 * @since 0.1.0
 */
public class DuplicateStageException extends GraphException {
  private static final long serialVersionUID = 1L;

  private final String stage;

  public DuplicateStageException(String stage) {
    super("stage already registered: " + stage);
    this.stage = stage;
  }

  public String stage() {
    return stage;
  }
}
