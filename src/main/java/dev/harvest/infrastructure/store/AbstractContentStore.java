package dev.harvest.infrastructure.store;

import dev.harvest.application.port.ClockPort;
import dev.harvest.application.port.ContentStorePort;
import dev.harvest.application.port.StoreException;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.UnownedVariantException;
import dev.harvest.domain.content.Attributes;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordKey;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.UpsertResult;
import dev.harvest.domain.content.VariantStatus;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Shared content store engine: copy-on-write variant maps, build lifecycle,
 * visibility rules and stage transactions.
 * <p><strong>Role:</strong> Subclasses decide how changed variants and build metadata are persisted.</p>
 * <p><strong>Consistency:</strong> a commit builds new immutable maps for every touched variant, hands
 * them to {@link #persistVariants(Map)}, and swaps them in only when persistence succeeded. Readers
 * therefore see either all or none of a stage's writes.</p>
 * <p><strong>Thread-safety:</strong> commits and prunes lock the variants they touch in name order;
 * reads are lock-free over immutable snapshots.</p>
 *
 * @since 0.1.0
 */
public abstract class AbstractContentStore implements ContentStorePort {
  private static final Logger log = LoggerFactory.getLogger(AbstractContentStore.class);
  // Staged marker for markSeen; compared by identity.
  private static final Map<String, Object> SEEN_ONLY = Collections.unmodifiableMap(new LinkedHashMap<>());

  private final ClockPort clock;
  private final ConcurrentMap<RecordVariant, Map<String, ContentRecord>> records = new ConcurrentHashMap<>();
  private final ConcurrentMap<RecordVariant, VariantStatus> statuses = new ConcurrentHashMap<>();
  private final ConcurrentMap<RecordVariant, ReentrantLock> locks = new ConcurrentHashMap<>();
  private final Set<RecordVariant> committedThisBuild = ConcurrentHashMap.newKeySet();
  private volatile String currentBuild;
  private volatile String lastBuild = "";

  protected AbstractContentStore(ClockPort clock) {
    this.clock = Objects.requireNonNull(clock, "clock");
  }

  /**
   * Persists the complete new contents of each changed variant.
   *
   * @param changed variant to its full record map after the change
   * @throws StoreException when the change cannot be made durable
   */
  protected abstract void persistVariants(Map<RecordVariant, Map<String, ContentRecord>> changed)
      throws StoreException;

  /**
   * Persists build metadata.
   *
   * @param lastBuildId id of the most recently opened build
   * @param variantStatuses status of every known variant
   * @throws StoreException when the metadata cannot be made durable
   */
  protected abstract void persistMetadata(String lastBuildId, Map<RecordVariant, VariantStatus> variantStatuses)
      throws StoreException;

  /**
   * Seeds state loaded from durable storage. Called by subclasses before the store is shared.
   *
   * @param loaded records per variant
   * @param loadedStatuses recorded variant statuses
   * @param loadedLastBuild last build id, empty when none
   */
  protected final void restore(
      Map<RecordVariant, Map<String, ContentRecord>> loaded,
      Map<RecordVariant, VariantStatus> loadedStatuses,
      String loadedLastBuild) {
    loaded.forEach((variant, map) -> records.put(variant, Collections.unmodifiableMap(new TreeMap<>(map))));
    statuses.putAll(loadedStatuses);
    lastBuild = Objects.requireNonNullElse(loadedLastBuild, "");
  }

  /**
   * Snapshot of every record, including those pending prune. Used by subclasses for rewrites.
   *
   * @return variant to records
   */
  protected final Map<RecordVariant, Map<String, ContentRecord>> snapshot() {
    return new TreeMap<>(records);
  }

  protected final Map<RecordVariant, VariantStatus> statusSnapshot() {
    return new TreeMap<>(statuses);
  }

  @Override
  public synchronized void openBuild(String buildId) throws StoreException {
    Objects.requireNonNull(buildId, "buildId");
    if (currentBuild != null) {
      throw new IllegalStateException("build " + currentBuild + " is still open");
    }
    persistMetadata(buildId, statusSnapshot());
    committedThisBuild.clear();
    lastBuild = buildId;
    currentBuild = buildId;
    log.debug("Opened content store build {}", buildId);
  }

  @Override
  public StoreTransaction begin(String stage, Set<RecordVariant> ownedVariants) {
    Objects.requireNonNull(stage, "stage");
    Objects.requireNonNull(ownedVariants, "ownedVariants");
    return new Transaction(stage, Set.copyOf(ownedVariants), requireOpenBuild());
  }

  @Override
  public List<ContentRecord> query(RecordVariant variant, Predicate<ContentRecord> predicate) {
    Objects.requireNonNull(variant, "variant");
    Objects.requireNonNull(predicate, "predicate");
    List<ContentRecord> result = new ArrayList<>();
    for (ContentRecord record : records.getOrDefault(variant, Map.of()).values()) {
      if (isVisible(record) && predicate.test(record)) {
        result.add(record);
      }
    }
    return result;
  }

  @Override
  public Optional<ContentRecord> find(RecordVariant variant, String naturalKey) {
    ContentRecord record = records.getOrDefault(variant, Map.of()).get(naturalKey);
    return record != null && isVisible(record) ? Optional.of(record) : Optional.empty();
  }

  @Override
  public Set<RecordVariant> variants() {
    Set<RecordVariant> result = new TreeSet<>(records.keySet());
    result.addAll(statuses.keySet());
    return Collections.unmodifiableSet(result);
  }

  @Override
  public VariantStatus status(RecordVariant variant) {
    return statuses.getOrDefault(variant, VariantStatus.UNKNOWN);
  }

  @Override
  public int pruneUnseen(RecordVariant variant) throws StoreException {
    String buildId = requireOpenBuild();
    ReentrantLock lock = lockFor(variant);
    lock.lock();
    try {
      Map<String, ContentRecord> current = records.getOrDefault(variant, Map.of());
      Map<String, ContentRecord> kept = new TreeMap<>();
      current.forEach((key, record) -> {
        if (record.seenIn(buildId)) {
          kept.put(key, record);
        }
      });
      int removed = current.size() - kept.size();
      if (removed > 0) {
        persistVariants(Map.of(variant, kept));
        records.put(variant, Collections.unmodifiableMap(kept));
        log.info("Pruned {} unseen {} records", removed, variant);
      }
      return removed;
    } finally {
      lock.unlock();
    }
  }

  @Override
  public synchronized void closeBuild(Map<RecordVariant, VariantStatus> variantStatuses) throws StoreException {
    requireOpenBuild();
    Map<RecordVariant, VariantStatus> merged = statusSnapshot();
    merged.putAll(variantStatuses);
    persistMetadata(lastBuild, merged);
    statuses.putAll(variantStatuses);
    committedThisBuild.clear();
    log.debug("Closed content store build {}", currentBuild);
    currentBuild = null;
  }

  @Override
  public String lastBuildId() {
    return lastBuild;
  }

  /** Whether a build is currently open. */
  public boolean buildOpen() {
    return currentBuild != null;
  }

  @Override
  public void close() throws StoreException {
    // nothing buffered
  }

  private boolean isVisible(ContentRecord record) {
    String build = currentBuild;
    return build == null
        || !committedThisBuild.contains(record.variant())
        || record.seenIn(build);
  }

  private String requireOpenBuild() {
    String build = currentBuild;
    if (build == null) {
      throw new IllegalStateException("no build is open");
    }
    return build;
  }

  private ReentrantLock lockFor(RecordVariant variant) {
    return locks.computeIfAbsent(variant, key -> new ReentrantLock());
  }

  private CommitSummary apply(Transaction tx) throws StoreException {
    if (!tx.buildId.equals(currentBuild)) {
      throw new StoreException("build " + tx.buildId + " is no longer open; cannot commit " + tx.stage);
    }
    List<ReentrantLock> held = new ArrayList<>();
    for (RecordVariant variant : new TreeSet<>(tx.owned)) {
      ReentrantLock lock = lockFor(variant);
      lock.lock();
      held.add(lock);
    }
    try {
      Instant now = clock.now();
      long inserted = 0;
      long updated = 0;
      long unchanged = 0;
      long affirmed = 0;
      Map<RecordVariant, Map<String, ContentRecord>> changed = new TreeMap<>();
      for (Map.Entry<RecordVariant, Map<String, Map<String, Object>>> staged : tx.writes.entrySet()) {
        RecordVariant variant = staged.getKey();
        Map<String, ContentRecord> next = new TreeMap<>(records.getOrDefault(variant, Map.of()));
        for (Map.Entry<String, Map<String, Object>> write : staged.getValue().entrySet()) {
          String key = write.getKey();
          Map<String, Object> attributes = write.getValue();
          ContentRecord existing = next.get(key);
          if (attributes == SEEN_ONLY) {
            if (existing != null) {
              next.put(key, existing.affirm(tx.stage, now, tx.buildId));
              affirmed++;
            }
          } else if (existing == null) {
            next.put(key, new ContentRecord(variant, key, attributes, tx.stage, now, tx.buildId));
            inserted++;
          } else if (existing.attributes().equals(attributes)) {
            next.put(key, existing.affirm(tx.stage, now, tx.buildId));
            unchanged++;
          } else {
            next.put(key, existing.rewrite(attributes, tx.stage, now, tx.buildId));
            updated++;
          }
        }
        changed.put(variant, next);
      }
      if (!changed.isEmpty()) {
        persistVariants(changed);
      }
      changed.forEach((variant, map) -> records.put(variant, Collections.unmodifiableMap(map)));
      committedThisBuild.addAll(tx.owned);
      return new CommitSummary(inserted, updated, unchanged, affirmed);
    } finally {
      for (ReentrantLock lock : held) {
        lock.unlock();
      }
    }
  }

  private final class Transaction implements StoreTransaction {
    private final String stage;
    private final Set<RecordVariant> owned;
    private final String buildId;
    private final Map<RecordVariant, Map<String, Map<String, Object>>> writes = new TreeMap<>();
    private State state = State.OPEN;

    private Transaction(String stage, Set<RecordVariant> owned, String buildId) {
      this.stage = stage;
      this.owned = owned;
      this.buildId = buildId;
    }

    @Override
    public String stage() {
      return stage;
    }

    @Override
    public UpsertResult upsert(RecordVariant variant, String naturalKey, Map<String, ?> attributes) {
      requireWritable(variant);
      String key = new RecordKey(variant, naturalKey).naturalKey();
      Map<String, Object> normalized = Attributes.normalize(attributes);
      Map<String, Map<String, Object>> variantWrites = writes.computeIfAbsent(variant, v -> new TreeMap<>());
      Map<String, Object> previous = variantWrites.get(key);
      if (previous == null || previous == SEEN_ONLY) {
        ContentRecord committed = records.getOrDefault(variant, Map.of()).get(key);
        previous = committed == null ? null : committed.attributes();
      }
      variantWrites.put(key, normalized);
      if (previous == null) {
        return UpsertResult.INSERTED;
      }
      return previous.equals(normalized) ? UpsertResult.UNCHANGED : UpsertResult.UPDATED;
    }

    @Override
    public boolean markSeen(RecordVariant variant, String naturalKey) {
      requireWritable(variant);
      String key = new RecordKey(variant, naturalKey).naturalKey();
      Map<String, Map<String, Object>> variantWrites = writes.computeIfAbsent(variant, v -> new TreeMap<>());
      Map<String, Object> staged = variantWrites.get(key);
      if (staged != null && staged != SEEN_ONLY) {
        return true;
      }
      if (!records.getOrDefault(variant, Map.of()).containsKey(key)) {
        return false;
      }
      variantWrites.put(key, SEEN_ONLY);
      return true;
    }

    @Override
    public List<ContentRecord> query(RecordVariant variant, Predicate<ContentRecord> predicate) {
      requireOpen();
      Map<String, Map<String, Object>> variantWrites = writes.get(variant);
      if (variantWrites == null || variantWrites.isEmpty()) {
        return AbstractContentStore.this.query(variant, predicate);
      }
      Instant now = clock.now();
      Map<String, ContentRecord> merged = new TreeMap<>(records.getOrDefault(variant, Map.of()));
      variantWrites.forEach((key, attributes) -> {
        if (attributes != SEEN_ONLY) {
          merged.put(key, new ContentRecord(variant, key, attributes, stage, now, buildId));
        }
      });
      List<ContentRecord> result = new ArrayList<>();
      for (ContentRecord record : merged.values()) {
        if (predicate.test(record)) {
          result.add(record);
        }
      }
      return result;
    }

    @Override
    public CommitSummary commit() throws StoreException {
      requireOpen();
      try {
        CommitSummary summary = apply(this);
        state = State.COMMITTED;
        return summary;
      } catch (StoreException ex) {
        state = State.ROLLED_BACK;
        writes.clear();
        throw ex;
      }
    }

    @Override
    public void rollback() {
      if (state == State.OPEN) {
        writes.clear();
        state = State.ROLLED_BACK;
      }
    }

    @Override
    public void close() {
      rollback();
    }

    private void requireWritable(RecordVariant variant) {
      requireOpen();
      Objects.requireNonNull(variant, "variant");
      if (!owned.contains(variant)) {
        throw new UnownedVariantException(stage, variant);
      }
    }

    private void requireOpen() {
      if (state != State.OPEN) {
        throw new IllegalStateException("transaction for " + stage + " is " + state);
      }
    }
  }

  private enum State {
    OPEN,
    COMMITTED,
    ROLLED_BACK
  }
}
