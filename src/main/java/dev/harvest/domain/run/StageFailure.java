package dev.harvest.domain.run;

import java.util.Objects;

/**
 * Serializable description of why a stage failed.
 *
 * @param kind failure classification
 * @param message human-readable detail
 * @param causeType fully qualified exception class name when the failure wraps one, else empty
 * @since 0.1.0
 */
public record StageFailure(StageErrorKind kind, String message, String causeType) {
  public StageFailure {
    Objects.requireNonNull(kind, "kind");
    message = Objects.requireNonNullElse(message, "");
    causeType = Objects.requireNonNullElse(causeType, "");
  }

  /**
   * Builds a failure from a caught exception.
   *
   * @param kind failure classification
   * @param message context message
   * @param cause underlying exception
   * @return failure description
   */
  public static StageFailure of(StageErrorKind kind, String message, Throwable cause) {
    String detail = message;
    if (cause != null && cause.getMessage() != null && !cause.getMessage().isBlank()) {
      detail = message == null || message.isBlank() ? cause.getMessage() : message + ": " + cause.getMessage();
    }
    return new StageFailure(kind, detail, cause == null ? "" : cause.getClass().getName());
  }

  @Override
  public String toString() {
    return kind + ": " + message;
  }
}
