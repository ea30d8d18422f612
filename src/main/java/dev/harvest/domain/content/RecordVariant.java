package dev.harvest.domain.content;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Kind of content record (organization, posting, event, member, ...).
 *
 * <p>Variants form an open set: stages introduce new ones by declaring ownership. Each variant has
 * exactly one owning stage.</p>
 *
 * @param name lower-case variant name ({@code [a-z0-9_]+})
 * @since 0.1.0
 */
public record RecordVariant(String name) implements Comparable<RecordVariant> {
  private static final Pattern NAME_PATTERN = Pattern.compile("^[a-z][a-z0-9_]*$");

  public static final RecordVariant ORGANIZATION = new RecordVariant("organization");
  public static final RecordVariant POSTING = new RecordVariant("posting");
  public static final RecordVariant EVENT = new RecordVariant("event");
  public static final RecordVariant MEMBER = new RecordVariant("member");

  public RecordVariant {
    Objects.requireNonNull(name, "name");
    if (!NAME_PATTERN.matcher(name).matches()) {
      throw new IllegalArgumentException("variant name must match [a-z][a-z0-9_]* (was '" + name + "')");
    }
  }

  /**
   * Returns the variant with the given name.
   *
   * @param name variant name
   * @return variant value
   */
  public static RecordVariant of(String name) {
    return new RecordVariant(name);
  }

  @Override
  public int compareTo(RecordVariant other) {
    return name.compareTo(other.name);
  }

  @Override
  public String toString() {
    return name;
  }
}
