package dev.harvest.application.port;

/**
 * Raised when the content store cannot commit, prune or persist records.
 *
 * @since 0.1.0
 */
public class StoreException extends Exception {
  private static final long serialVersionUID = 1L;

  public StoreException(String message) {
    super(message);
  }

  public StoreException(String message, Throwable cause) {
    super(message, cause);
  }
}
