package dev.harvest.application.pipeline;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.Locale;
import java.util.concurrent.ThreadLocalRandom;

/**
 * Generates sortable, unique build identifiers such as {@code 20240501T101500Z-3f9a1c}.
 *
 * @since 0.1.0
 */
public final class BuildIds {
  private static final DateTimeFormatter FORMAT =
      DateTimeFormatter.ofPattern("yyyyMMdd'T'HHmmss'Z'", Locale.ROOT).withZone(ZoneOffset.UTC);

  private BuildIds() {}

  /**
   * Creates an identifier for a build starting at {@code startedAt}.
   *
   * @param startedAt build start instant
   * @return identifier
   */
  public static String next(Instant startedAt) {
    int suffix = ThreadLocalRandom.current().nextInt(1 << 24);
    return FORMAT.format(startedAt) + "-" + String.format(Locale.ROOT, "%06x", suffix);
  }
}
