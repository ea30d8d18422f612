package dev.harvest.infrastructure.store;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * On-disk schema of the file content store and its migration chain.
 *
 * <p>Version history:</p>
 * <ol>
 *   <li>records carry {@code updatedBy} and {@code lastSeenAt}.</li>
 *   <li>{@code updatedBy} is renamed {@code sourceStage}; {@code lastSeenBuild} is added.</li>
 * </ol>
 *
 * @since 0.1.0
 */
final class StoreSchema {
  static final int CURRENT_VERSION = 2;

  private static final List<StoreMigration> MIGRATIONS = List.of(new AddLastSeenBuild());

  private StoreSchema() {}

  /**
   * Returns the migrations needed to bring {@code version} up to {@link #CURRENT_VERSION}, in order.
   *
   * @param version persisted schema version
   * @return migration chain; empty when already current
   * @throws IllegalArgumentException when the version is newer than this build understands
   */
  static List<StoreMigration> chainFrom(int version) {
    if (version > CURRENT_VERSION) {
      throw new IllegalArgumentException(
          "store schema version " + version + " is newer than supported version " + CURRENT_VERSION);
    }
    if (version < 1) {
      throw new IllegalArgumentException("invalid store schema version " + version);
    }
    return MIGRATIONS.stream().filter(m -> m.fromVersion() >= version).toList();
  }

  private static final class AddLastSeenBuild implements StoreMigration {
    @Override
    public int fromVersion() {
      return 1;
    }

    @Override
    public String description() {
      return "rename updatedBy to sourceStage; add lastSeenBuild";
    }

    @Override
    public Map<String, Object> migrateRecord(Map<String, Object> raw) {
      Map<String, Object> migrated = new LinkedHashMap<>(raw);
      Object updatedBy = migrated.remove("updatedBy");
      migrated.putIfAbsent("sourceStage", updatedBy == null ? "" : updatedBy);
      migrated.putIfAbsent("lastSeenBuild", "");
      return migrated;
    }
  }
}
