package dev.harvest.infrastructure.stage.feed;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Optional;
import java.util.StringJoiner;

/**
 * Canonical form of posting URLs used as natural keys.
 * <p>Lower-cases scheme and host, drops default ports, fragments and {@code utm_*} tracking
 * parameters, and keeps the remaining query parameters in their original order.</p>
 *
 * @since 0.1.0
 */
public final class UrlCanonicalizer {
  private UrlCanonicalizer() {}

  /**
   * Canonicalizes an absolute http(s) URL.
   *
   * @param url raw URL
   * @return canonical URL, empty when the input is not an absolute http(s) URL
   */
  public static Optional<String> canonicalize(String url) {
    if (url == null || url.isBlank()) {
      return Optional.empty();
    }
    URI uri;
    try {
      uri = new URI(url.trim());
    } catch (URISyntaxException ex) {
      return Optional.empty();
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https") || uri.getHost() == null) {
      return Optional.empty();
    }
    StringBuilder result = new StringBuilder();
    result.append(scheme).append("://").append(uri.getHost().toLowerCase(Locale.ROOT));
    int port = uri.getPort();
    if (port >= 0 && !(scheme.equals("http") && port == 80) && !(scheme.equals("https") && port == 443)) {
      result.append(':').append(port);
    }
    String path = uri.getRawPath();
    result.append(path == null || path.isEmpty() ? "/" : path);
    String query = uri.getRawQuery();
    if (query != null) {
      StringJoiner kept = new StringJoiner("&");
      for (String parameter : query.split("&")) {
        if (!parameter.isEmpty() && !parameter.toLowerCase(Locale.ROOT).startsWith("utm_")) {
          kept.add(parameter);
        }
      }
      if (kept.length() > 0) {
        result.append('?').append(kept);
      }
    }
    return Optional.of(result.toString());
  }
}
