package dev.harvest.infrastructure.store;

import dev.harvest.application.json.JsonSupport;
import dev.harvest.application.port.ClockPort;
import dev.harvest.application.port.StoreException;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.infrastructure.io.AtomicFiles;
import java.io.IOException;
import java.nio.channels.FileChannel;
import java.nio.channels.FileLock;
import java.nio.channels.OverlappingFileLockException;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Durable content store persisted as JSON documents under a data directory.
 * <p><strong>Layout:</strong>
 * <ul>
 *   <li>{@code store-meta.json}: schema version, migration history, last build id, variant statuses.</li>
 *   <li>{@code records/<variant>.json}: every record of one variant, sorted by natural key.</li>
 *   <li>{@code commit.journal}: present only while a multi-variant commit is being applied.</li>
 *   <li>{@code store.lock}: exclusive lock held while the store is open.</li>
 * </ul>
 * <p><strong>Commit protocol:</strong> new variant documents are written to {@code .pending} files,
 * the journal naming them is written atomically, each pending file is moved over its target, and the
 * journal is deleted. Opening the store rolls a leftover journal forward and deletes pending files no
 * journal refers to, so a crash never leaves a commit half-applied.</p>
 * <p><strong>Thread-safety:</strong> inherits {@link AbstractContentStore}'s locking; persistence calls
 * are additionally serialized on this instance.</p>
 *
 * @since 0.1.0
 */
public final class FileContentStore extends AbstractContentStore {
  private static final Logger log = LoggerFactory.getLogger(FileContentStore.class);
  private static final String META_FILE = "store-meta.json";
  private static final String JOURNAL_FILE = "commit.journal";
  private static final String LOCK_FILE = "store.lock";
  private static final String RECORDS_DIR = "records";
  private static final String PENDING_SUFFIX = ".pending";

  private final Path dataDir;
  private final Path recordsDir;
  private final ClockPort clock;
  private final JsonSupport json = JsonSupport.shared();
  private final List<Map<String, Object>> migrationHistory = new ArrayList<>();
  private final FileChannel lockChannel;
  private final FileLock lock;

  private FileContentStore(Path dataDir, ClockPort clock, FileChannel lockChannel, FileLock lock) {
    super(clock);
    this.dataDir = dataDir;
    this.recordsDir = dataDir.resolve(RECORDS_DIR);
    this.clock = clock;
    this.lockChannel = lockChannel;
    this.lock = lock;
  }

  /**
   * Opens (or creates) the store under {@code dataDir}, recovering interrupted commits and migrating
   * older schema versions.
   *
   * @param dataDir data directory
   * @param clock time source for record instants and migration history
   * @return open store; close it to release the directory lock
   * @throws StoreException when the directory is locked by another process or cannot be read
   */
  public static FileContentStore open(Path dataDir, ClockPort clock) throws StoreException {
    Objects.requireNonNull(dataDir, "dataDir");
    Objects.requireNonNull(clock, "clock");
    FileChannel channel = null;
    try {
      Files.createDirectories(dataDir.resolve(RECORDS_DIR));
      channel = FileChannel.open(
          dataDir.resolve(LOCK_FILE), StandardOpenOption.CREATE, StandardOpenOption.WRITE);
      FileLock fileLock = tryLock(channel);
      if (fileLock == null) {
        channel.close();
        throw new StoreException("content store " + dataDir + " is in use by another process");
      }
      FileContentStore store = new FileContentStore(dataDir, clock, channel, fileLock);
      store.load();
      return store;
    } catch (IOException | IllegalArgumentException | DateTimeParseException ex) {
      closeQuietly(channel);
      throw new StoreException("failed to open content store at " + dataDir + ": " + ex.getMessage(), ex);
    } catch (StoreException ex) {
      closeQuietly(channel);
      throw ex;
    }
  }

  public Path dataDir() {
    return dataDir;
  }

  /**
   * Migration history recorded in the store metadata, oldest first.
   *
   * @return entries with {@code fromVersion}, {@code toVersion}, {@code description}, {@code appliedAt}
   */
  public synchronized List<Map<String, Object>> migrationHistory() {
    return List.copyOf(migrationHistory);
  }

  @Override
  protected synchronized void persistVariants(Map<RecordVariant, Map<String, ContentRecord>> changed)
      throws StoreException {
    List<Path> pending = new ArrayList<>();
    Path journal = dataDir.resolve(JOURNAL_FILE);
    try {
      for (Map.Entry<RecordVariant, Map<String, ContentRecord>> entry : changed.entrySet()) {
        Path target = variantFile(entry.getKey());
        Path staged = target.resolveSibling(target.getFileName() + PENDING_SUFFIX);
        AtomicFiles.writeDurably(staged, json.writePretty(variantDocument(entry.getKey(), entry.getValue())));
        pending.add(staged);
      }
      List<Object> names = new ArrayList<>();
      for (Path staged : pending) {
        names.add(staged.getFileName().toString());
      }
      Map<String, Object> journalDoc = new LinkedHashMap<>();
      journalDoc.put("createdAt", clock.now().toString());
      journalDoc.put("files", names);
      AtomicFiles.write(journal, json.writePretty(journalDoc));
    } catch (IOException ex) {
      for (Path staged : pending) {
        deleteQuietly(staged);
      }
      throw new StoreException("failed to stage commit: " + ex.getMessage(), ex);
    }
    try {
      applyJournal(journal);
    } catch (IOException ex) {
      throw new StoreException(
          "commit journaled but not fully applied; it will be completed when the store is reopened", ex);
    }
  }

  @Override
  protected synchronized void persistMetadata(String lastBuildId, Map<RecordVariant, VariantStatus> variantStatuses)
      throws StoreException {
    try {
      writeMetadata(lastBuildId, variantStatuses);
    } catch (IOException ex) {
      throw new StoreException("failed to write store metadata: " + ex.getMessage(), ex);
    }
  }

  @Override
  public synchronized void close() throws StoreException {
    try {
      if (lock.isValid()) {
        lock.release();
      }
      lockChannel.close();
    } catch (IOException ex) {
      throw new StoreException("failed to release content store lock", ex);
    }
  }

  private void load() throws IOException, StoreException {
    Path journal = dataDir.resolve(JOURNAL_FILE);
    if (Files.exists(journal)) {
      log.warn("Completing interrupted commit recorded in {}", journal);
      applyJournal(journal);
    }
    discardOrphanedPending();

    Path metaPath = dataDir.resolve(META_FILE);
    int schemaVersion = StoreSchema.CURRENT_VERSION;
    String lastBuild = "";
    Map<RecordVariant, VariantStatus> statuses = new TreeMap<>();
    if (Files.exists(metaPath)) {
      Map<String, Object> meta = json.parseObject(Files.readString(metaPath, StandardCharsets.UTF_8));
      schemaVersion = ((Number) Objects.requireNonNullElse(meta.get("schemaVersion"), 1)).intValue();
      lastBuild = Objects.toString(meta.get("lastBuild"), "");
      Object variantsNode = meta.get("variants");
      if (variantsNode instanceof Map<?, ?> variants) {
        variants.forEach((name, status) -> statuses.put(
            RecordVariant.of(name.toString()), VariantStatus.valueOf(status.toString())));
      }
      Object history = meta.get("migrations");
      if (history instanceof List<?> entries) {
        for (Object entry : entries) {
          if (entry instanceof Map<?, ?> map) {
            Map<String, Object> copy = new LinkedHashMap<>();
            map.forEach((k, v) -> copy.put(k.toString(), v));
            migrationHistory.add(copy);
          }
        }
      }
    }

    List<StoreMigration> chain = StoreSchema.chainFrom(schemaVersion);
    Map<RecordVariant, Map<String, ContentRecord>> loaded = new TreeMap<>();
    try (DirectoryStream<Path> files = Files.newDirectoryStream(recordsDir, "*.json")) {
      for (Path file : files) {
        Map<String, Object> document = json.parseObject(Files.readString(file, StandardCharsets.UTF_8));
        RecordVariant variant = RecordVariant.of(Objects.toString(document.get("variant"), ""));
        loaded.put(variant, readRecords(variant, document, chain));
      }
    }
    restore(loaded, statuses, lastBuild);

    if (!chain.isEmpty()) {
      Instant now = clock.now();
      for (StoreMigration migration : chain) {
        Map<String, Object> entry = new LinkedHashMap<>();
        entry.put("fromVersion", migration.fromVersion());
        entry.put("toVersion", migration.fromVersion() + 1);
        entry.put("description", migration.description());
        entry.put("appliedAt", now.toString());
        migrationHistory.add(entry);
        log.info("Migrated content store from schema v{}: {}", migration.fromVersion(), migration.description());
      }
      if (!loaded.isEmpty()) {
        persistVariants(loaded);
      }
      writeMetadata(lastBuild, statuses);
    } else if (!Files.exists(metaPath)) {
      writeMetadata(lastBuild, statuses);
    }
    log.debug("Opened content store {} with {} variants", dataDir, loaded.size());
  }

  private Map<String, ContentRecord> readRecords(
      RecordVariant variant, Map<String, Object> document, List<StoreMigration> chain) {
    Map<String, ContentRecord> result = new TreeMap<>();
    Object recordsNode = document.get("records");
    if (!(recordsNode instanceof List<?> rows)) {
      throw new IllegalArgumentException("variant document " + variant + " has no records array");
    }
    for (Object row : rows) {
      if (!(row instanceof Map<?, ?> rawRow)) {
        throw new IllegalArgumentException("variant document " + variant + " contains a non-object record");
      }
      Map<String, Object> raw = new LinkedHashMap<>();
      for (Map.Entry<?, ?> entry : rawRow.entrySet()) {
        raw.put(entry.getKey().toString(), entry.getValue());
      }
      for (StoreMigration migration : chain) {
        raw = migration.migrateRecord(raw);
      }
      String key = Objects.toString(raw.get("key"), "");
      @SuppressWarnings("unchecked")
      Map<String, Object> attributes = raw.get("attributes") instanceof Map<?, ?> attrs
          ? (Map<String, Object>) attrs
          : Map.of();
      result.put(key, new ContentRecord(
          variant,
          key,
          attributes,
          Objects.toString(raw.get("sourceStage"), ""),
          Instant.parse(Objects.toString(raw.get("lastSeenAt"), Instant.EPOCH.toString())),
          Objects.toString(raw.get("lastSeenBuild"), "")));
    }
    return result;
  }

  private Map<String, Object> variantDocument(RecordVariant variant, Map<String, ContentRecord> records) {
    List<Object> rows = new ArrayList<>(records.size());
    for (ContentRecord record : records.values()) {
      Map<String, Object> row = new LinkedHashMap<>();
      row.put("key", record.naturalKey());
      row.put("sourceStage", record.sourceStage());
      row.put("lastSeenAt", record.lastSeenAt().toString());
      row.put("lastSeenBuild", record.lastSeenBuild());
      row.put("attributes", record.attributes());
      rows.add(row);
    }
    Map<String, Object> document = new LinkedHashMap<>();
    document.put("variant", variant.name());
    document.put("schemaVersion", StoreSchema.CURRENT_VERSION);
    document.put("records", rows);
    return document;
  }

  private void writeMetadata(String lastBuildId, Map<RecordVariant, VariantStatus> variantStatuses)
      throws IOException {
    Map<String, Object> variants = new TreeMap<>();
    variantStatuses.forEach((variant, status) -> variants.put(variant.name(), status.name()));
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("schemaVersion", StoreSchema.CURRENT_VERSION);
    meta.put("lastBuild", lastBuildId);
    meta.put("variants", variants);
    meta.put("migrations", List.copyOf(migrationHistory));
    AtomicFiles.write(dataDir.resolve(META_FILE), json.writePretty(meta));
  }

  private void applyJournal(Path journal) throws IOException {
    Map<String, Object> document = json.parseObject(Files.readString(journal, StandardCharsets.UTF_8));
    Object files = document.get("files");
    if (files instanceof List<?> names) {
      for (Object name : names) {
        Path staged = recordsDir.resolve(name.toString());
        String stagedName = staged.getFileName().toString();
        Path target = staged.resolveSibling(stagedName.substring(0, stagedName.length() - PENDING_SUFFIX.length()));
        if (Files.exists(staged)) {
          AtomicFiles.move(staged, target);
        }
      }
    }
    Files.delete(journal);
  }

  private void discardOrphanedPending() throws IOException {
    try (DirectoryStream<Path> orphans = Files.newDirectoryStream(recordsDir, "*" + PENDING_SUFFIX)) {
      for (Path orphan : orphans) {
        log.warn("Discarding uncommitted staging file {}", orphan.getFileName());
        Files.delete(orphan);
      }
    }
  }

  private Path variantFile(RecordVariant variant) {
    return recordsDir.resolve(variant.name() + ".json");
  }

  private static FileLock tryLock(FileChannel channel) throws IOException {
    try {
      return channel.tryLock();
    } catch (OverlappingFileLockException ex) {
      return null;
    }
  }

  private static void deleteQuietly(Path path) {
    try {
      Files.deleteIfExists(path);
    } catch (IOException ex) {
      log.warn("Failed to delete staging file {}: {}", path, ex.getMessage());
    }
  }

  private static void closeQuietly(FileChannel channel) {
    if (channel == null) {
      return;
    }
    try {
      channel.close();
    } catch (IOException ex) {
      log.debug("Failed to close lock channel", ex);
    }
  }
}
