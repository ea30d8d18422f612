package dev.harvest.infrastructure.store;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.UnownedVariantException;
import dev.harvest.domain.content.CommitSummary;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.content.UpsertResult;
import dev.harvest.domain.content.VariantStatus;
import dev.harvest.support.MutableClock;
import java.time.Duration;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class InMemoryContentStoreTest {
  private static final RecordVariant POSTING = RecordVariant.POSTING;
  private static final RecordVariant ORGANIZATION = RecordVariant.ORGANIZATION;

  private MutableClock clock;
  private InMemoryContentStore store;

  @BeforeEach
  void setUp() {
    clock = MutableClock.startingAt("2024-02-10T12:00:00Z");
    store = new InMemoryContentStore(clock);
  }

  @Test
  void upsertReportsInsertUpdateAndUnchanged() throws Exception {
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      assertEquals(UpsertResult.INSERTED, tx.upsert(POSTING, "p1", Map.of("title", "Engineer")));
      assertEquals(UpsertResult.INSERTED, tx.upsert(POSTING, "p2", Map.of("title", "Designer")));
      tx.commit();
    }
    store.closeBuild(Map.of(POSTING, VariantStatus.FRESH));

    store.openBuild("b2");
    CommitSummary summary;
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      assertEquals(UpsertResult.UNCHANGED, tx.upsert(POSTING, "p1", Map.of("title", "Engineer")));
      assertEquals(UpsertResult.UPDATED, tx.upsert(POSTING, "p2", Map.of("title", "Senior Designer")));
      summary = tx.commit();
    }

    assertEquals(new CommitSummary(0, 1, 1, 0), summary);
    assertEquals("Senior Designer", store.find(POSTING, "p2").orElseThrow().text("title"));
  }

  @Test
  void integerAttributesCompareEqualAcrossBoxedTypes() throws Exception {
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      tx.upsert(POSTING, "p1", Map.of("openings", 3));
      tx.commit();
    }
    store.closeBuild(Map.of());
    store.openBuild("b2");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      assertEquals(UpsertResult.UNCHANGED, tx.upsert(POSTING, "p1", Map.of("openings", 3L)));
    }
  }

  @Test
  void writesOutsideOwnedVariantsAreRejected() throws Exception {
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      UnownedVariantException ex = assertThrows(UnownedVariantException.class,
          () -> tx.upsert(ORGANIZATION, "acme", Map.of("name", "Acme")));
      assertEquals("postings", ex.stage());
      assertEquals(ORGANIZATION, ex.variant());
      assertThrows(UnownedVariantException.class, () -> tx.markSeen(ORGANIZATION, "acme"));
    }
  }

  @Test
  void uncommittedWritesAreInvisibleAndDiscardedOnClose() throws Exception {
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      tx.upsert(POSTING, "p1", Map.of("title", "Engineer"));
      assertTrue(store.find(POSTING, "p1").isEmpty());
      assertEquals(1, tx.query(POSTING, record -> true).size());
    }

    assertTrue(store.query(POSTING, record -> true).isEmpty());
  }

  @Test
  void recordsNotAffirmedAreHiddenOnceTheOwnerCommitsThenPruned() throws Exception {
    seed("p1", "p2", "p3");
    clock.advance(Duration.ofHours(1));

    store.openBuild("b2");
    assertEquals(3, store.query(POSTING, record -> true).size());
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      tx.upsert(POSTING, "p1", Map.of("title", "p1"));
      assertTrue(tx.markSeen(POSTING, "p2"));
      assertFalse(tx.markSeen(POSTING, "missing"));
      CommitSummary summary = tx.commit();
      assertEquals(1, summary.affirmed());
      assertEquals(1, summary.unchanged());
    }

    assertEquals(2, store.query(POSTING, record -> true).size());
    assertTrue(store.find(POSTING, "p3").isEmpty());
    assertEquals(1, store.pruneUnseen(POSTING));
    store.closeBuild(Map.of(POSTING, VariantStatus.FRESH));

    ContentRecord affirmed = store.find(POSTING, "p2").orElseThrow();
    assertEquals("b2", affirmed.lastSeenBuild());
    assertEquals(clock.now(), affirmed.lastSeenAt());
    assertEquals(VariantStatus.FRESH, store.status(POSTING));
  }

  @Test
  void unseenRecordsStayVisibleWhenTheOwnerDidNotCommit() throws Exception {
    seed("p1", "p2");

    store.openBuild("b2");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      tx.upsert(POSTING, "p1", Map.of("title", "p1"));
      tx.rollback();
    }
    store.closeBuild(Map.of(POSTING, VariantStatus.PARTIAL));

    assertEquals(2, store.query(POSTING, record -> true).size());
    assertEquals(VariantStatus.PARTIAL, store.status(POSTING));
  }

  @Test
  void committedTransactionCannotBeReused() throws Exception {
    store.openBuild("b1");
    StoreTransaction tx = store.begin("postings", Set.of(POSTING));
    tx.commit();

    assertThrows(IllegalStateException.class, () -> tx.upsert(POSTING, "p1", Map.of()));
    assertThrows(IllegalStateException.class, tx::commit);
  }

  @Test
  void buildLifecycleIsEnforced() throws Exception {
    assertThrows(IllegalStateException.class, () -> store.begin("postings", Set.of(POSTING)));
    store.openBuild("b1");
    assertThrows(IllegalStateException.class, () -> store.openBuild("b2"));
    store.closeBuild(Map.of());

    assertEquals("b1", store.lastBuildId());
    assertFalse(store.buildOpen());
    assertEquals(VariantStatus.UNKNOWN, store.status(ORGANIZATION));
  }

  private void seed(String... keys) throws Exception {
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin("postings", Set.of(POSTING))) {
      for (String key : keys) {
        tx.upsert(POSTING, key, Map.of("title", key));
      }
      tx.commit();
    }
    store.closeBuild(Map.of(POSTING, VariantStatus.FRESH));
  }
}
