package ca.gc.cra.rulesync.config;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Supplies flattened default settings for each RULESYNC command.
 *
 * <p>The defaults are the single source of truth for optional YAML keys; {@link SyncConfig#fromMap(Map)} and
 * {@link CacheConfig#fromMap(Map)} fall back to the same values.</p>
 */
public final class DefaultsForMode {
  private static final Map<String, String> COMMON_DEFAULTS = buildCommonDefaults();

  private DefaultsForMode() {}

  /**
   * Returns a flattened map of defaults for the requested command merged with common defaults.
   *
   * @param mode command name ({@code sync} or {@code cache})
   * @return unmodifiable map of default key/value pairs as strings
   * @throws IllegalArgumentException for an unknown command
   */
  public static Map<String, String> asFlatMap(String mode) {
    Objects.requireNonNull(mode, "mode");
    String normalized = mode.trim().toLowerCase(Locale.ROOT);
    Map<String, String> defaults = new LinkedHashMap<>(COMMON_DEFAULTS);
    defaults.putAll(switch (normalized) {
      case "sync" -> buildSyncDefaults();
      case "cache" -> buildCacheDefaults();
      default -> throw new IllegalArgumentException("Unsupported mode: " + mode);
    });
    return Map.copyOf(defaults);
  }

  private static Map<String, String> buildCommonDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("cacheDir", SyncConfig.DEFAULT_CACHE_DIR);
    map.put("cacheTtlHours", Integer.toString(SyncConfig.DEFAULT_CACHE_TTL_HOURS));
    map.put("metricsExporter", "none");
    map.put("otelEndpoint", "");
    map.put("otelResourceAttributes", "");
    return Map.copyOf(map);
  }

  private static Map<String, String> buildSyncDefaults() {
    SyncConfig defaults = SyncConfig.defaults();
    Map<String, String> map = new LinkedHashMap<>();
    map.put("cacheEvictHours", Integer.toString(defaults.cacheEvictHours()));
    map.put("workDir", SyncConfig.DEFAULT_WORK_DIR);
    map.put("outputDir", SyncConfig.DEFAULT_OUTPUT_DIR);
    map.put("version", Integer.toString(defaults.version()));
    map.put("concurrency", Integer.toString(defaults.concurrency()));
    map.put("maxRetries", Integer.toString(defaults.maxRetries()));
    map.put("retryDelayMillis", Long.toString(defaults.retryDelay().toMillis()));
    map.put("requestTimeoutSeconds", Long.toString(defaults.requestTimeout().toSeconds()));
    map.put("useCache", Boolean.toString(defaults.useCache()));
    map.put("supportResume", Boolean.toString(defaults.supportResume()));
    map.put("userAgent", defaults.userAgent());
    map.put("denylist", String.join(",", defaults.denylist()));
    map.put("validateCidr", Boolean.toString(defaults.validateCidr()));
    map.put("progressIntervalMillis", Long.toString(defaults.progressIntervalMillis()));
    map.put("rulesetParallelism", Integer.toString(defaults.rulesetParallelism()));
    map.put("compilerCommand", "");
    map.put("compiledDir", SyncConfig.DEFAULT_COMPILED_DIR);
    map.put("compilerTimeoutSeconds", Long.toString(defaults.compilerTimeout().toSeconds()));
    map.put("keepWorkFiles", Boolean.toString(defaults.keepWorkFiles()));
    map.put("only", "");
    map.put("dryRun", "false");
    return map;
  }

  private static Map<String, String> buildCacheDefaults() {
    Map<String, String> map = new LinkedHashMap<>();
    map.put("olderThanHours", "");
    return map;
  }
}
