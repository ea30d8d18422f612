package dev.harvest.infrastructure.stage.feed;

import dev.harvest.application.cache.FetchedPayload;
import dev.harvest.logging.Logs;
import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link FeedClient} using the JDK HTTP client.
 * <p>Follows redirects, applies a per-request timeout and rejects non-2xx answers.</p>
 *
 * @since 0.1.0
 */
public final class HttpFeedClient implements FeedClient {
  private static final Logger log = LoggerFactory.getLogger(HttpFeedClient.class);
  private static final String ACCEPT =
      "application/rss+xml, application/atom+xml, application/xml;q=0.9, text/xml;q=0.8, */*;q=0.1";

  private final HttpClient client;
  private final Duration requestTimeout;
  private final String userAgent;

  /**
   * Creates a client.
   *
   * @param requestTimeout connect and response timeout per request
   * @param userAgent value sent as {@code User-Agent}
   */
  public HttpFeedClient(Duration requestTimeout, String userAgent) {
    this.requestTimeout = Objects.requireNonNull(requestTimeout, "requestTimeout");
    this.userAgent = Objects.requireNonNull(userAgent, "userAgent");
    this.client = HttpClient.newBuilder()
        .followRedirects(HttpClient.Redirect.NORMAL)
        .connectTimeout(requestTimeout)
        .build();
  }

  @Override
  public FetchedPayload fetch(String url) throws IOException, InterruptedException {
    URI uri;
    try {
      uri = URI.create(url);
    } catch (IllegalArgumentException ex) {
      throw new IOException("invalid feed URL " + Logs.safeUrl(url), ex);
    }
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(requestTimeout)
        .header("Accept", ACCEPT)
        .header("User-Agent", userAgent)
        .GET()
        .build();
    log.debug("GET {}", Logs.safeUrl(url));
    HttpResponse<byte[]> response = client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    int status = response.statusCode();
    if (status < 200 || status > 299) {
      throw new IOException("HTTP " + status + " from " + Logs.safeUrl(url));
    }
    String contentType = response.headers().firstValue("Content-Type").orElse("application/xml");
    return new FetchedPayload(response.body(), contentType);
  }
}
