package dev.harvest.infrastructure.stage.feed;

import dev.harvest.application.cache.StageCache;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.content.ContentRecord;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.stage.StageDescriptor;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns raw feed entries into {@code posting} records keyed by canonical URL.
 * <p>Entries without a usable http(s) link are skipped. When two entries share a canonical URL the
 * one with the smaller entry key wins.</p>
 *
 * @since 0.1.0
 */
public final class PostingNormalizeStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(PostingNormalizeStage.class);
  public static final String NAME = "normalize_postings";

  private final StageDescriptor descriptor = StageDescriptor.builder(NAME)
      .dependsOn(FeedFetchStage.NAME)
      .version("1")
      .owns(RecordVariant.POSTING)
      .build();

  @Override
  public StageDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public StageResult run(StageCache cache, StoreTransaction store) {
    List<ContentRecord> entries = new ArrayList<>(store.query(FeedFetchStage.FEED_ENTRY, record -> true));
    entries.sort(Comparator.comparing(ContentRecord::naturalKey));
    Set<String> seen = new HashSet<>();
    int skipped = 0;
    for (ContentRecord entry : entries) {
      Optional<String> url = UrlCanonicalizer.canonicalize(entry.text("link"));
      if (url.isEmpty()) {
        skipped++;
        continue;
      }
      if (!seen.add(url.get())) {
        log.debug("Duplicate posting {} from {}", url.get(), entry.naturalKey());
        continue;
      }
      store.upsert(RecordVariant.POSTING, url.get(), posting(entry, url.get()));
    }
    if (skipped > 0) {
      log.info("Skipped {} feed entries without a usable link", skipped);
    }
    return StageResult.ok(entries.size());
  }

  private static Map<String, Object> posting(ContentRecord entry, String url) {
    Map<String, Object> posting = new LinkedHashMap<>();
    posting.put("url", url);
    posting.put("title", collapseWhitespace(entry.text("title")));
    posting.put("feed", Objects.toString(entry.text("feed"), ""));
    posting.put("published", Objects.toString(entry.text("published"), ""));
    posting.put("summary", collapseWhitespace(entry.text("summary")));
    return posting;
  }

  static String collapseWhitespace(String text) {
    return text == null ? "" : text.trim().replaceAll("\\s+", " ");
  }
}
