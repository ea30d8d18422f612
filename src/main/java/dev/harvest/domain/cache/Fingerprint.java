package dev.harvest.domain.cache;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Lower-case hexadecimal SHA-256 digest used as cache key and as stage input/output fingerprint.
 *
 * @param hex 64 lower-case hex characters
 * @since 0.1.0
 */
public record Fingerprint(String hex) {
  private static final Pattern HEX = Pattern.compile("^[0-9a-f]{64}$");

  public Fingerprint {
    Objects.requireNonNull(hex, "hex");
    if (!HEX.matcher(hex).matches()) {
      throw new IllegalArgumentException("fingerprint must be 64 lower-case hex characters");
    }
  }

  /**
   * Parses a stored fingerprint.
   *
   * @param hex digest text
   * @return fingerprint
   */
  public static Fingerprint of(String hex) {
    return new Fingerprint(hex);
  }

  /** Two-character prefix used to fan out on-disk directories. */
  public String shard() {
    return hex.substring(0, 2);
  }

  /** Abbreviated form for logs and reports. */
  public String shortForm() {
    return hex.substring(0, 12);
  }

  @Override
  public String toString() {
    return hex;
  }
}
