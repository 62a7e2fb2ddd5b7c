package ca.gc.cra.rulesync.config;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Merges configuration from defaults, YAML, and CLI sources while enforcing precedence and cross-key rules.
 */
public final class ConfigMerger {
  private static final String INPUT_PLACEHOLDER = "{input}";

  private ConfigMerger() {}

  /**
   * Builds an effective configuration map using precedence CLI &gt; YAML &gt; defaults.
   *
   * @param mode active command
   * @param yaml optional YAML-derived settings for the command
   * @param cli CLI key/value overrides (may be empty)
   * @param defaults embedded defaults for the command
   * @param warn consumer invoked for overrides and suspicious combinations
   * @return immutable merged configuration map
   * @throws IllegalArgumentException when validation fails
   */
  public static Map<String, String> buildEffectiveConfig(
      String mode,
      Optional<Map<String, String>> yaml,
      Map<String, String> cli,
      Map<String, String> defaults,
      Consumer<String> warn) {
    Objects.requireNonNull(mode, "mode");
    Objects.requireNonNull(yaml, "yaml");
    Map<String, String> yamlCopy = yaml.orElse(Map.of());
    Map<String, String> cliCopy = cli == null ? Map.of() : cli;
    Consumer<String> warnings = warn == null ? message -> {} : warn;

    Map<String, String> merged = new LinkedHashMap<>(defaults == null ? Map.of() : defaults);
    merged.putAll(yamlCopy);
    for (Map.Entry<String, String> entry : cliCopy.entrySet()) {
      String key = entry.getKey();
      if (key == null || entry.getValue() == null) {
        continue;
      }
      if (yamlCopy.containsKey(key)) {
        warnings.accept("CLI overrides YAML for key: " + key);
      }
      merged.put(key, entry.getValue());
    }

    if ("sync".equalsIgnoreCase(mode)) {
      validateSync(merged, warnings);
    }
    return Map.copyOf(merged);
  }

  private static void validateSync(Map<String, String> effective, Consumer<String> warn) {
    String compiler = trim(effective.get("compilerCommand"));
    if (!compiler.isEmpty() && !compiler.contains(INPUT_PLACEHOLDER)) {
      throw new IllegalArgumentException("compilerCommand must contain the " + INPUT_PLACEHOLDER + " placeholder");
    }
    String ttl = trim(effective.get("cacheTtlHours"));
    String evict = trim(effective.get("cacheEvictHours"));
    // Malformed numbers are reported by SyncConfig.fromMap with their key.
    if (isDigits(ttl) && isDigits(evict) && Long.parseLong(evict) < Long.parseLong(ttl)) {
      warn.accept("cacheEvictHours (" + evict + ") is shorter than cacheTtlHours (" + ttl
          + "); fresh entries will be pruned at startup");
    }
  }

  private static boolean isDigits(String value) {
    if (value.isEmpty() || value.length() > 9) {
      return false;
    }
    for (int i = 0; i < value.length(); i++) {
      if (!Character.isDigit(value.charAt(i))) {
        return false;
      }
    }
    return true;
  }

  private static String trim(String value) {
    return value == null ? "" : value.trim();
  }
}
