package dev.harvest.validation;

/**
 * Numeric range checks for configuration values.
 *
 * @since 0.1.0
 */
public final class Numbers {
  private Numbers() {}

  /**
   * Ensures {@code value} lies within {@code [min, max]}.
   *
   * @param name setting name used in messages
   * @param value value to check
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return {@code value}
   * @throws IllegalArgumentException when out of range
   */
  public static long requireRange(String name, long value, long min, long max) {
    if (value < min || value > max) {
      throw new IllegalArgumentException(
          (name == null || name.isBlank() ? "value" : name)
              + " must be between " + min + " and " + max + " (was " + value + ")");
    }
    return value;
  }

  /**
   * Parses a decimal integer and checks its range.
   *
   * @param name setting name used in messages
   * @param raw text to parse
   * @param min inclusive lower bound
   * @param max inclusive upper bound
   * @return parsed value
   * @throws IllegalArgumentException when not a number or out of range
   */
  public static long parseRange(String name, String raw, long min, long max) {
    long value;
    try {
      value = Long.parseLong(raw == null ? "" : raw.trim());
    } catch (NumberFormatException ex) {
      throw new IllegalArgumentException(name + " must be an integer (was '" + raw + "')", ex);
    }
    return requireRange(name, value, min, max);
  }
}
