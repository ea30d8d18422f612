package dev.harvest.application.port;

import dev.harvest.domain.content.RecordVariant;

/**
 * Raised when a stage writes to a record variant it does not own.
 *
 * @since 0.1.0
 */
public class UnownedVariantException extends IllegalStateException {
  private static final long serialVersionUID = 1L;

  private final String stage;
  private final RecordVariant variant;

  public UnownedVariantException(String stage, RecordVariant variant) {
    super("stage " + stage + " does not own record variant " + variant);
    this.stage = stage;
    this.variant = variant;
  }

  public String stage() {
    return stage;
  }

  public RecordVariant variant() {
    return variant;
  }
}
