package dev.harvest.domain.content;

/**
 * Freshness of a record variant after the latest build, as exposed to the site generator.
 *
 * @since 0.1.0
 */
public enum VariantStatus {
  /** The owning stage ran successfully in the latest build; unaffirmed records were pruned. */
  FRESH,
  /** The owning stage was skipped because nothing changed; data is from an earlier build. */
  CARRIED_OVER,
  /** The owning stage failed, was blocked or cancelled; last-known-good data was retained. */
  PARTIAL,
  /** No build has recorded a status for the variant. */
  UNKNOWN
}
