package dev.harvest.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges defaults, YAML and CLI settings into one effective map (CLI &gt; YAML &gt; defaults).
 *
 * @since 0.1.0
 */
public final class ConfigMerger {

  private ConfigMerger() {}

  /**
   * Builds the effective configuration for a command.
   *
   * @param mode command name used in validation messages
   * @param yaml flattened YAML settings, if a file was given
   * @param cli CLI {@code key=value} settings
   * @param defaults command defaults
   * @param warn receives a message for each YAML key overridden on the command line
   * @return immutable effective configuration
   * @throws IllegalArgumentException when the combination of settings is invalid
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> defaultsCopy = defaults == null ? Map.of() : defaults;
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;

    Map<String, String> merged = new LinkedHashMap<>(defaultsCopy);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null) {
        continue;
      }
      if (yamlCopy.containsKey(key) && warn != null) {
        warn.accept("CLI overrides YAML for key: " + key);
      }
      if (entry.getValue() != null) {
        merged.put(key, entry.getValue());
      }
    }

    validate(mode, merged);
    return Map.copyOf(merged);
  }

  private static void validate(String mode, Map<String, String> effective) {
    if (!"build".equalsIgnoreCase(mode)) {
      return;
    }
    if (parseBoolean(effective.get("dryRun")) && !trim(effective.get("clearCache")).isEmpty()) {
      throw new IllegalArgumentException("clearCache cannot be combined with dryRun");
    }
    if (parseBoolean(effective.get("forceAll")) && !trim(effective.get("force")).isEmpty()) {
      throw new IllegalArgumentException("force and forceAll are mutually exclusive");
    }
  }

  private static boolean parseBoolean(String value) {
    return value != null && Boolean.parseBoolean(value.trim());
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
