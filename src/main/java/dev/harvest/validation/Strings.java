package dev.harvest.validation;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * <strong>What:</strong> Validation helpers for textual configuration values.
 * <p>Messages name the offending setting so CLI users can fix the right key.</p>
 * <p><strong>Thread-safety:</strong> Stateless.</p>
 *
 * @since 0.1.0
 */
public final class Strings {
  private static final Pattern TAG_PATTERN = Pattern.compile("^[a-z0-9][a-z0-9_.-]*$");

  private Strings() {}

  /**
   * Trims a value and rejects blanks and control characters.
   *
   * @param name setting name used in messages
   * @param value raw value
   * @return trimmed value
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if blank or containing control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, label(name));
    if (containsControl(raw)) {
      throw new IllegalArgumentException(label(name) + " must not contain control characters");
    }
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(label(name) + " must not be blank");
    }
    return trimmed;
  }

  /**
   * Validates a stage name or cache tag: lower-case letters, digits, dot, underscore, hyphen.
   *
   * @param name setting name used in messages
   * @param value raw value
   * @return trimmed value
   */
  public static String requireTag(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    if (!TAG_PATTERN.matcher(trimmed).matches()) {
      throw new IllegalArgumentException(label(name)
          + " must start with a lower-case letter or digit and contain only [a-z0-9_.-] (was '" + trimmed + "')");
    }
    return trimmed;
  }

  /**
   * Splits a comma-separated list of tags, ignoring empty items.
   *
   * @param name setting name used in messages
   * @param raw comma-separated value; {@code null} or blank yields an empty set
   * @return validated items in input order
   */
  public static Set<String> tagList(String name, String raw) {
    if (raw == null || raw.isBlank()) {
      return Set.of();
    }
    Set<String> result = new LinkedHashSet<>();
    for (String item : raw.split(",")) {
      if (!item.isBlank()) {
        result.add(requireTag(name, item));
      }
    }
    return Collections.unmodifiableSet(result);
  }

  /**
   * Rejects values longer than {@code maxLength} or containing non-printable ASCII characters.
   *
   * @param name setting name used in messages
   * @param value raw value
   * @param maxLength maximum accepted length
   * @return trimmed value
   */
  public static String requirePrintableAscii(String name, String value, int maxLength) {
    String trimmed = requireNonBlank(name, value);
    if (trimmed.length() > maxLength) {
      throw new IllegalArgumentException(label(name) + " length must be <= " + maxLength);
    }
    for (int i = 0; i < trimmed.length(); i++) {
      char c = trimmed.charAt(i);
      if (c < 0x20 || c > 0x7E) {
        throw new IllegalArgumentException(label(name) + " must contain printable ASCII characters");
      }
    }
    return trimmed;
  }

  private static boolean containsControl(CharSequence value) {
    for (int i = 0; i < value.length(); i++) {
      if (Character.isISOControl(value.charAt(i))) {
        return true;
      }
    }
    return false;
  }

  private static String label(String name) {
    return name == null || name.isBlank() ? "value" : name;
  }
}
