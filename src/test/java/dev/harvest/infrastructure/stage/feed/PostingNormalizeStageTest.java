package dev.harvest.infrastructure.stage.feed;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.infrastructure.store.InMemoryContentStore;
import dev.harvest.support.MutableClock;
import java.util.Map;
import java.util.Set;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class PostingNormalizeStageTest {
  private InMemoryContentStore store;

  @BeforeEach
  void setUp() throws Exception {
    store = new InMemoryContentStore(MutableClock.startingAt("2024-04-01T00:00:00Z"));
    store.openBuild("b1");
    try (StoreTransaction tx = store.begin(FeedFetchStage.NAME, Set.of(FeedFetchStage.FEED_ENTRY))) {
      entry(tx, "jobs:1", "https://Jobs.example/1?utm_source=rss", "  Backend\n  Engineer ");
      entry(tx, "jobs:1-dup", "https://jobs.example/1", "Backend Engineer (repost)");
      entry(tx, "jobs:2", "https://jobs.example/2", "Designer");
      entry(tx, "jobs:3", "", "No link");
      tx.commit();
    }
  }

  @Test
  void canonicalizesDeduplicatesAndSkipsUnlinkedEntries() throws Exception {
    PostingNormalizeStage stage = new PostingNormalizeStage();
    StageResult result;
    try (StoreTransaction tx = store.begin(stage.name(), stage.descriptor().ownedVariants())) {
      result = stage.run(null, tx);
      tx.commit();
    }

    assertTrue(result.isOk());
    assertEquals(4, result.stats().itemsProcessed());
    assertEquals(2, store.query(RecordVariant.POSTING, record -> true).size());
    ContentRecord first = store.find(RecordVariant.POSTING, "https://jobs.example/1").orElseThrow();
    assertEquals("Backend Engineer", first.text("title"));
    assertEquals("jobs", first.text("feed"));
    assertEquals("https://jobs.example/1", first.text("url"));
  }

  @Test
  void collapsesWhitespace() {
    assertEquals("a b c", PostingNormalizeStage.collapseWhitespace("  a \t b\n\nc "));
    assertEquals("", PostingNormalizeStage.collapseWhitespace(null));
  }

  private static void entry(StoreTransaction tx, String key, String link, String title) {
    tx.upsert(FeedFetchStage.FEED_ENTRY, key, Map.of(
        "feed", "jobs", "id", key, "title", title, "link", link, "published", "", "summary", ""));
  }
}
