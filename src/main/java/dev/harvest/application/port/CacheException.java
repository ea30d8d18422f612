package dev.harvest.application.port;

/**
 * Raised when the fetch cache cannot read or write an entry.
 *
 * <p>Cache failures are never fatal: callers degrade to miss behaviour.</p>
 *
 * @since 0.1.0
 */
public class CacheException extends Exception {
  private static final long serialVersionUID = 1L;

  public CacheException(String message) {
    super(message);
  }

  public CacheException(String message, Throwable cause) {
    super(message, cause);
  }
}
