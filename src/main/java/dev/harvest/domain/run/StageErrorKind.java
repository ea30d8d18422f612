package dev.harvest.domain.run;

/**
 * Classification of a stage failure, recorded on the stage run.
 *
 * @since 0.1.0
 */
public enum StageErrorKind {
  /** An external source could not be fetched. */
  FETCH,
  /** Fetched data could not be parsed or normalized. */
  TRANSFORM,
  /** The stage wrote to a record variant it does not own. */
  OWNERSHIP_CONFLICT,
  /** The content store rejected the stage's commit. */
  STORE,
  /** The run function threw an unexpected exception. */
  UNEXPECTED
}
