package dev.harvest.domain.content;

import java.util.Comparator;
import java.util.Objects;

/**
 * Identity of a content record: its variant plus natural key.
 *
 * @param variant record variant
 * @param naturalKey key unique within the variant
 * @since 0.1.0
 */
public record RecordKey(RecordVariant variant, String naturalKey) implements Comparable<RecordKey> {
  private static final Comparator<RecordKey> ORDER =
      Comparator.comparing(RecordKey::variant).thenComparing(RecordKey::naturalKey);

  public RecordKey {
    Objects.requireNonNull(variant, "variant");
    Objects.requireNonNull(naturalKey, "naturalKey");
    if (naturalKey.isBlank()) {
      throw new IllegalArgumentException("naturalKey must not be blank for variant " + variant);
    }
  }

  @Override
  public int compareTo(RecordKey other) {
    return ORDER.compare(this, other);
  }

  @Override
  public String toString() {
    return variant + "/" + naturalKey;
  }
}
