package dev.harvest.application.graph;

import dev.harvest.domain.content.RecordVariant;

/**
 * Raised when a stage declares ownership of a record variant that another stage already owns.
 *
 * @since 0.1.0
 */
public class OwnershipConflictException extends GraphException {
  private static final long serialVersionUID = 1L;

  private final RecordVariant variant;
  private final String owner;
  private final String claimant;

  public OwnershipConflictException(RecordVariant variant, String owner, String claimant) {
    super("record variant " + variant + " is owned by " + owner + "; " + claimant + " cannot claim it");
    this.variant = variant;
    this.owner = owner;
    this.claimant = claimant;
  }

  public RecordVariant variant() {
    return variant;
  }

  public String owner() {
    return owner;
  }

  public String claimant() {
    return claimant;
  }
}
