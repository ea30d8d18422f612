package dev.harvest.application.cache;

import java.io.IOException;

/**
 * Retrieves a payload from an external source on a cache miss.
 *
 * @since 0.1.0
 */
@FunctionalInterface
public interface Fetcher {
  /**
   * Fetches the payload.
   *
   * @return fetched payload
   * @throws IOException when the source cannot be reached or answers with an error
   * @throws InterruptedException when interrupted while waiting for the source
   */
  FetchedPayload fetch() throws IOException, InterruptedException;
}
