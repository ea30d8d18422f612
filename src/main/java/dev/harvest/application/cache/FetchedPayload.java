package dev.harvest.application.cache;

import java.util.Objects;

/**
 * Raw response returned by a {@link Fetcher}.
 *
 * @param body response bytes
 * @param contentType media type, may be {@code null}
 * @since 0.1.0
 */
public record FetchedPayload(byte[] body, String contentType) {
  public FetchedPayload {
    body = Objects.requireNonNull(body, "body").clone();
  }

  @Override
  public byte[] body() {
    return body.clone();
  }
}
