package ca.gc.cra.rulesync.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * Shared helpers for mixing CLI arguments with the YAML configuration file.
 */
final class ConfigCliUtils {
  static final String DEFAULT_CONFIG_FILE = "rulesync.yaml";

  private ConfigCliUtils() {}

  /**
   * Removes and returns the {@code config} argument.
   *
   * @param args mutable CLI key/value map
   * @return configured path, or {@code null} when absent
   */
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

  static Path configPathOrDefault(String configPath) {
    return Path.of(configPath == null ? DEFAULT_CONFIG_FILE : configPath);
  }
}
