package dev.harvest.domain.content;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Normalizes record attribute maps to JSON-compatible immutable values.
 *
 * <p>Numbers are widened to {@link Long} or {@link Double} so that a value written as {@code int} and
 * read back from disk as {@code long} compares equal. Maps are key-sorted.</p>
 *
 * @since 0.1.0
 */
public final class Attributes {
  private Attributes() {
    // Utility
  }

  /**
   * Returns an immutable, key-sorted deep copy of {@code source}.
   *
   * @param source attribute map; {@code null} is treated as empty
   * @return normalized copy
   * @throws IllegalArgumentException when a value is not a JSON scalar, list or map
   */
  public static Map<String, Object> normalize(Map<String, ?> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> sorted = new TreeMap<>();
    for (Map.Entry<String, ?> entry : source.entrySet()) {
      String key = entry.getKey();
      if (key == null || key.isBlank()) {
        throw new IllegalArgumentException("attribute names must not be blank");
      }
      sorted.put(key, normalizeValue(key, entry.getValue()));
    }
    return Collections.unmodifiableMap(sorted);
  }

  private static Object normalizeValue(String key, Object value) {
    if (value == null || value instanceof String || value instanceof Boolean) {
      return value;
    }
    if (value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte) {
      return ((Number) value).longValue();
    }
    if (value instanceof BigInteger big) {
      return big.longValueExact();
    }
    if (value instanceof Float || value instanceof Double || value instanceof BigDecimal) {
      return ((Number) value).doubleValue();
    }
    if (value instanceof CharSequence text) {
      return text.toString();
    }
    if (value instanceof Enum<?> constant) {
      return constant.name();
    }
    if (value instanceof Map<?, ?> nested) {
      Map<String, Object> copy = new TreeMap<>();
      for (Map.Entry<?, ?> entry : nested.entrySet()) {
        String nestedKey = String.valueOf(entry.getKey());
        copy.put(nestedKey, normalizeValue(key + "." + nestedKey, entry.getValue()));
      }
      return Collections.unmodifiableMap(copy);
    }
    if (value instanceof Iterable<?> items) {
      List<Object> copy = new ArrayList<>();
      for (Object item : items) {
        copy.add(normalizeValue(key, item));
      }
      return Collections.unmodifiableList(copy);
    }
    throw new IllegalArgumentException(
        "attribute " + key + " has unsupported type " + value.getClass().getName());
  }
}
