package dev.harvest.api;

import dev.harvest.application.port.CacheException;
import dev.harvest.infrastructure.cache.FileSystemCacheAdapter;
import dev.harvest.infrastructure.time.SystemClockAdapter;
import dev.harvest.logging.LoggingConfigurator;
import dev.harvest.validation.Strings;
import java.io.IOException;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code harvest cache}: evicts every cache entry carrying the given tags (stage names).
 *
 * @since 0.1.0
 */
public final class CacheCli {
  private static final Logger log = LoggerFactory.getLogger(CacheCli.class);
  private static final String SUMMARY_USAGE = "usage: cache tag=STAGE[,STAGE...] [cacheDir=PATH] [config=FILE]";

  private CacheCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    Path cacheDir;
    Set<String> tags;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("cache", kv, log);
      cacheDir = Path.of(Strings.requireNonBlank("cacheDir", effective.get("cacheDir")));
      tags = Strings.tagList("tag", effective.get("tag"));
      if (tags.isEmpty()) {
        throw new IllegalArgumentException("tag is required");
      }
    } catch (IllegalArgumentException ex) {
      log.error("Invalid cache arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration", ex);
      return ExitCode.IO_ERROR;
    }

    try {
      FileSystemCacheAdapter cache = new FileSystemCacheAdapter(cacheDir, new SystemClockAdapter());
      for (String tag : tags) {
        int removed = cache.evictTag(tag);
        CliPrinter.println("Evicted " + removed + " cache entries tagged " + tag);
      }
      return ExitCode.SUCCESS;
    } catch (IOException | CacheException ex) {
      log.error("Cache eviction failed in {}", cacheDir, ex);
      return ExitCode.IO_ERROR;
    }
  }
}
