package dev.harvest.infrastructure.stage.feed;

import dev.harvest.application.cache.FetchedPayload;
import java.io.IOException;

/**
 * Retrieves a raw feed document.
 *
 * @since 0.1.0
 */
public interface FeedClient {
  /**
   * Downloads a feed.
   *
   * @param url feed URL
   * @return document bytes and media type
   * @throws IOException when the server cannot be reached or answers with a non-2xx status
   * @throws InterruptedException when interrupted while waiting for the response
   */
  FetchedPayload fetch(String url) throws IOException, InterruptedException;
}
