package dev.harvest.infrastructure.stage.feed;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One item of an RSS or Atom feed.
 *
 * @param feed configured feed name
 * @param id guid or Atom id; empty when the feed has none
 * @param title item title
 * @param link item link; empty when absent
 * @param published publication date as written in the feed
 * @param summary description or summary text
 * @since 0.1.0
 */
public record FeedEntry(String feed, String id, String title, String link, String published, String summary) {
  public FeedEntry {
    Objects.requireNonNull(feed, "feed");
    id = Objects.requireNonNullElse(id, "").trim();
    title = Objects.requireNonNullElse(title, "").trim();
    link = Objects.requireNonNullElse(link, "").trim();
    published = Objects.requireNonNullElse(published, "").trim();
    summary = Objects.requireNonNullElse(summary, "").trim();
  }

  /**
   * Natural key of the entry: feed name plus guid, or plus link when there is no guid.
   *
   * @return key, empty when the entry has neither id nor link
   */
  public String naturalKey() {
    String local = id.isEmpty() ? link : id;
    return local.isEmpty() ? "" : feed + ":" + local;
  }

  Map<String, Object> attributes() {
    Map<String, Object> attributes = new LinkedHashMap<>();
    attributes.put("feed", feed);
    attributes.put("id", id);
    attributes.put("title", title);
    attributes.put("link", link);
    attributes.put("published", published);
    attributes.put("summary", summary);
    return attributes;
  }
}
