package dev.harvest.infrastructure.store;

import java.util.Map;

/**
 * Upgrades persisted record documents from one schema version to the next.
 *
 * @since 0.1.0
 */
interface StoreMigration {
  /** Schema version this migration reads. */
  int fromVersion();

  /** Short description stored in the migration history. */
  String description();

  /**
   * Rewrites one raw record document.
   *
   * @param raw record members as parsed from disk
   * @return record members in the next schema version
   */
  Map<String, Object> migrateRecord(Map<String, Object> raw);
}
