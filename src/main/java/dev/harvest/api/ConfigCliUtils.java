package dev.harvest.api;

import dev.harvest.config.ConfigMerger;
import dev.harvest.config.DefaultsForMode;
import dev.harvest.config.YamlConfigLoader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;

/** Shared steps of the CLI commands: config file lookup and layered merge. */
final class ConfigCliUtils {

  private ConfigCliUtils() {}

  static String extractConfigPath(Map<String, String> args) {
    if (args == null || args.isEmpty()) {
      return null;
    }
    for (String key : new String[] {"config", "--config"}) {
      String value = args.remove(key);
      if (value != null && !value.isBlank()) {
        return value.trim();
      }
    }
    return null;
  }

  /**
   * Loads the optional YAML file named by {@code config=} and merges it with defaults and CLI values.
   *
   * @param mode command name
   * @param kv mutable CLI arguments; {@code config} is removed
   * @param log command logger receiving override warnings
   * @return effective settings
   * @throws IllegalArgumentException when the file is missing or malformed, or settings conflict
   * @throws IOException when the file cannot be read
   */
  static Map<String, String> effectiveConfig(String mode, Map<String, String> kv, Logger log)
      throws IOException {
    String configPath = extractConfigPath(kv);
    Optional<Map<String, String>> yaml = Optional.empty();
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        throw new IllegalArgumentException("Configuration file does not exist: " + yamlPath);
      }
      yaml = YamlConfigLoader.load(yamlPath, mode);
      log.debug("Loaded {} settings from {}", yaml.map(Map::size).orElse(0), yamlPath);
    }
    return ConfigMerger.buildEffectiveConfig(mode, yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
  }

  static boolean parseBoolean(Map<String, String> map, String key) {
    if (map == null) {
      return false;
    }
    String value = map.get(key);
    return value != null && Boolean.parseBoolean(value.trim());
  }
}
