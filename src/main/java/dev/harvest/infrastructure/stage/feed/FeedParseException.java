package dev.harvest.infrastructure.stage.feed;

/**
 * Raised when a document is not a well-formed RSS or Atom feed.
 *
 * @since 0.1.0
 */
public final class FeedParseException extends Exception {
  private static final long serialVersionUID = 1L;

  public FeedParseException(String message) {
    super(message);
  }

  public FeedParseException(String message, Throwable cause) {
    super(message, cause);
  }
}
