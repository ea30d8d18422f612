package dev.harvest.infrastructure.stage.feed;

import dev.harvest.application.cache.StageCache;
import dev.harvest.application.port.StoreTransaction;
import dev.harvest.application.port.stage.Stage;
import dev.harvest.application.port.stage.StageResult;
import dev.harvest.domain.cache.CacheEntry;
import dev.harvest.domain.cache.FetchRequest;
import dev.harvest.domain.content.RecordVariant;
import dev.harvest.domain.run.StageErrorKind;
import dev.harvest.domain.stage.RefreshPolicy;
import dev.harvest.domain.stage.StageDescriptor;
import dev.harvest.logging.Logs;
import java.io.IOException;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Downloads every configured RSS/Atom feed and stores one {@code feed_entry}
 * record per item.
 * <p>Feeds are fetched through the stage cache, so repeated builds within the cache lifetime do not
 * touch the network. The stage runs on every build because feed drift is only observable by fetching.
 * A feed that cannot be fetched or parsed fails the whole stage, which keeps the previous entries.</p>
 *
 * @since 0.1.0
 */
public final class FeedFetchStage implements Stage {
  private static final Logger log = LoggerFactory.getLogger(FeedFetchStage.class);
  public static final String NAME = "fetch_feeds";
  public static final RecordVariant FEED_ENTRY = RecordVariant.of("feed_entry");

  private final StageDescriptor descriptor = StageDescriptor.builder(NAME)
      .version("1")
      .owns(FEED_ENTRY)
      .refreshPolicy(RefreshPolicy.EVERY_BUILD)
      .build();
  private final Map<String, String> feeds;
  private final FeedClient client;
  private final FeedParser parser;

  /**
   * Creates the stage.
   *
   * @param feeds feed name to URL
   * @param client transport used on cache misses
   * @param parser feed document parser
   */
  public FeedFetchStage(Map<String, String> feeds, FeedClient client, FeedParser parser) {
    this.feeds = Collections.unmodifiableMap(new TreeMap<>(Objects.requireNonNull(feeds, "feeds")));
    this.client = Objects.requireNonNull(client, "client");
    this.parser = Objects.requireNonNull(parser, "parser");
  }

  @Override
  public StageDescriptor descriptor() {
    return descriptor;
  }

  @Override
  public StageResult run(StageCache cache, StoreTransaction store) throws InterruptedException {
    long items = 0;
    for (Map.Entry<String, String> feed : feeds.entrySet()) {
      String name = feed.getKey();
      String url = feed.getValue();
      FetchRequest request = FetchRequest.of(url);
      CacheEntry response;
      try {
        response = cache.fetch(request, () -> client.fetch(url));
      } catch (IOException ex) {
        return StageResult.failed(StageErrorKind.FETCH, "feed " + name + " (" + Logs.safeUrl(url) + ")", ex);
      }
      List<FeedEntry> entries;
      try {
        entries = parser.parse(name, response.payload());
      } catch (FeedParseException ex) {
        cache.invalidate(request);
        return StageResult.failed(StageErrorKind.TRANSFORM, "feed " + name, ex);
      }
      int stored = 0;
      for (FeedEntry entry : entries) {
        String key = entry.naturalKey();
        if (key.isEmpty()) {
          log.debug("Skipping entry without id or link in feed {}", name);
          continue;
        }
        store.upsert(FEED_ENTRY, key, entry.attributes());
        stored++;
      }
      log.info("Feed {}: {} entries", name, stored);
      items += stored;
    }
    return StageResult.ok(items);
  }
}
