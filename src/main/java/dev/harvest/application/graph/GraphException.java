package dev.harvest.application.graph;

/**
 * Base type for invalid pipeline graphs. Graph errors are fatal and raised before any stage runs.
 *
 * @since 0.1.0
 */
public class GraphException extends Exception {
  private static final long serialVersionUID = 1L;

  public GraphException(String message) {
    super(message);
  }
}
