package dev.harvest.domain.cache;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;

/**
 * External request a stage wants cached, e.g. a feed URL or an API query.
 *
 * @param target request target such as a URL or query name
 * @param parameters request parameters; order does not affect the cache key
 * @since 0.1.0
 */
public record FetchRequest(String target, Map<String, String> parameters) {
  public FetchRequest {
    Objects.requireNonNull(target, "target");
    if (target.isBlank()) {
      throw new IllegalArgumentException("target must not be blank");
    }
    parameters = parameters == null || parameters.isEmpty()
        ? Collections.emptyMap()
        : Collections.unmodifiableMap(new TreeMap<>(parameters));
  }

  /**
   * Creates a request without parameters.
   *
   * @param target request target
   * @return request
   */
  public static FetchRequest of(String target) {
    return new FetchRequest(target, Map.of());
  }
}
