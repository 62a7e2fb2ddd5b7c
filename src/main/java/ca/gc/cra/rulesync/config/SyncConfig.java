package ca.gc.cra.rulesync.config;

import ca.gc.cra.rulesync.domain.fetch.FetchOptions;
import ca.gc.cra.rulesync.infrastructure.http.JdkHttpSourceTransport;
import ca.gc.cra.rulesync.validation.Numbers;
import ca.gc.cra.rulesync.validation.Strings;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * <strong>What:</strong> Immutable settings for one {@code sync} run.
 * <p><strong>Why:</strong> Gathers the directory layout, fetch policy, merge options and compiler settings that
 * {@code RulesetSyncUseCase} needs, validated once at startup so a bad value fails before any download.</p>
 * <p><strong>Thread-safety:</strong> Immutable record; safe for concurrent reads.</p>
 *
 * @param cacheDir download cache directory
 * @param cacheTtl freshness window of cache entries
 * @param cacheEvictHours cache entries older than this are deleted when a run starts
 * @param workDir parent directory of the per-ruleset download directories
 * @param outputDir directory receiving {@code <name>.json}
 * @param version format version written to every ruleset
 * @param concurrency download pool size per ruleset
 * @param maxRetries retries after the first attempt
 * @param retryDelay base backoff delay
 * @param requestTimeout per-request timeout
 * @param useCache whether the download cache is consulted
 * @param supportResume whether partial downloads are resumed with range requests
 * @param userAgent HTTP user agent
 * @param denylist case-insensitive substrings removed from every ruleset
 * @param validateCidr whether malformed CIDR values are dropped
 * @param progressIntervalMillis minimum spacing of progress logs
 * @param rulesetParallelism number of rulesets processed concurrently
 * @param compilerCommand external compiler template; empty disables compilation
 * @param compiledDir directory receiving compiled artifacts
 * @param compilerTimeout maximum wall time per compilation
 * @param keepWorkFiles whether per-ruleset download directories survive the run
 * @param only ruleset names to run; empty selects every ruleset
 * @param dryRun whether to print the plan without downloading
 * @since 0.1.0
 */
public record SyncConfig(
    Path cacheDir,
    Duration cacheTtl,
    int cacheEvictHours,
    Path workDir,
    Path outputDir,
    int version,
    int concurrency,
    int maxRetries,
    Duration retryDelay,
    Duration requestTimeout,
    boolean useCache,
    boolean supportResume,
    String userAgent,
    List<String> denylist,
    boolean validateCidr,
    long progressIntervalMillis,
    int rulesetParallelism,
    Optional<String> compilerCommand,
    Path compiledDir,
    Duration compilerTimeout,
    boolean keepWorkFiles,
    Set<String> only,
    boolean dryRun) {

  static final String DEFAULT_CACHE_DIR = "temp/cache";
  static final int DEFAULT_CACHE_TTL_HOURS = 24;
  static final String DEFAULT_WORK_DIR = "temp";
  static final String DEFAULT_OUTPUT_DIR = "output/json";
  static final String DEFAULT_COMPILED_DIR = "output/srs";
  private static final int MAX_HOURS = 24 * 365;
  private static final int MAX_CONCURRENCY = 64;
  private static final int MAX_RETRIES = 10;
  private static final int MAX_PARALLELISM = 16;
  private static final int MAX_USER_AGENT_LENGTH = 512;

  public SyncConfig {
    Objects.requireNonNull(cacheDir, "cacheDir");
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    Objects.requireNonNull(workDir, "workDir");
    Objects.requireNonNull(outputDir, "outputDir");
    Objects.requireNonNull(retryDelay, "retryDelay");
    Objects.requireNonNull(requestTimeout, "requestTimeout");
    Objects.requireNonNull(userAgent, "userAgent");
    denylist = List.copyOf(Objects.requireNonNull(denylist, "denylist"));
    compilerCommand = Objects.requireNonNullElse(compilerCommand, Optional.<String>empty())
        .map(String::trim)
        .filter(s -> !s.isEmpty());
    Objects.requireNonNull(compiledDir, "compiledDir");
    Objects.requireNonNull(compilerTimeout, "compilerTimeout");
    only = Set.copyOf(Objects.requireNonNull(only, "only"));
    if (version < 1) {
      throw new IllegalArgumentException("version must be >= 1");
    }
    Numbers.requireRange("concurrency", concurrency, 1, MAX_CONCURRENCY);
    Numbers.requireRange("maxRetries", maxRetries, 0, MAX_RETRIES);
    Numbers.requireRange("rulesetParallelism", rulesetParallelism, 1, MAX_PARALLELISM);
    if (progressIntervalMillis < 0) {
      throw new IllegalArgumentException("progressIntervalMillis must be >= 0");
    }
  }

  /**
   * Returns the built-in defaults.
   *
   * @return configuration used when neither YAML nor CLI override a key
   */
  public static SyncConfig defaults() {
    return new SyncConfig(
        Path.of(DEFAULT_CACHE_DIR),
        Duration.ofHours(DEFAULT_CACHE_TTL_HOURS),
        48,
        Path.of(DEFAULT_WORK_DIR),
        Path.of(DEFAULT_OUTPUT_DIR),
        1,
        5,
        3,
        Duration.ofMillis(1_000),
        Duration.ofSeconds(30),
        true,
        true,
        JdkHttpSourceTransport.DEFAULT_USER_AGENT,
        List.of("ruleset.skk.moe"),
        false,
        500L,
        1,
        Optional.empty(),
        Path.of(DEFAULT_COMPILED_DIR),
        Duration.ofSeconds(300),
        false,
        Set.of(),
        false);
  }

  /**
   * Builds a configuration from flattened key/value settings.
   *
   * @param args merged settings, typically from {@link ConfigMerger}; missing keys take defaults
   * @return validated configuration
   * @throws IllegalArgumentException when a value is malformed or out of range
   */
  public static SyncConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    SyncConfig defaults = defaults();
    String compiler = kv.get("compilerCommand");
    return new SyncConfig(
        parsePath("cacheDir", kv.get("cacheDir"), defaults.cacheDir()),
        Duration.ofHours(parseBoundedInt(kv, "cacheTtlHours", DEFAULT_CACHE_TTL_HOURS, 1, MAX_HOURS)),
        parseBoundedInt(kv, "cacheEvictHours", defaults.cacheEvictHours(), 1, MAX_HOURS),
        parsePath("workDir", kv.get("workDir"), defaults.workDir()),
        parsePath("outputDir", kv.get("outputDir"), defaults.outputDir()),
        parseBoundedInt(kv, "version", defaults.version(), 1, Integer.MAX_VALUE),
        parseBoundedInt(kv, "concurrency", defaults.concurrency(), 1, MAX_CONCURRENCY),
        parseBoundedInt(kv, "maxRetries", defaults.maxRetries(), 0, MAX_RETRIES),
        Duration.ofMillis(parseBoundedInt(kv, "retryDelayMillis", 1_000, 0, 600_000)),
        Duration.ofSeconds(parseBoundedInt(kv, "requestTimeoutSeconds", 30, 1, 3_600)),
        parseBoolean("useCache", kv.get("useCache"), defaults.useCache()),
        parseBoolean("supportResume", kv.get("supportResume"), defaults.supportResume()),
        parseUserAgent(kv.get("userAgent"), defaults.userAgent()),
        parseList(kv.get("denylist"), defaults.denylist()),
        parseBoolean("validateCidr", kv.get("validateCidr"), defaults.validateCidr()),
        parseBoundedInt(kv, "progressIntervalMillis", 500, 0, 3_600_000),
        parseBoundedInt(kv, "rulesetParallelism", defaults.rulesetParallelism(), 1, MAX_PARALLELISM),
        Optional.ofNullable(compiler),
        parsePath("compiledDir", kv.get("compiledDir"), defaults.compiledDir()),
        Duration.ofSeconds(parseBoundedInt(kv, "compilerTimeoutSeconds", 300, 1, 86_400)),
        parseBoolean("keepWorkFiles", kv.get("keepWorkFiles"), defaults.keepWorkFiles()),
        new LinkedHashSet<>(parseList(kv.get("only"), List.of())),
        parseBoolean("dryRun", kv.get("dryRun"), defaults.dryRun()));
  }

  /**
   * Derives the per-URL fetch policy.
   *
   * @return fetch options built from the retry, cache and resume settings
   */
  public FetchOptions fetchOptions() {
    return new FetchOptions(maxRetries, retryDelay, useCache, supportResume);
  }

  /**
   * Returns a copy with caching turned off, used by {@code --no-cache}.
   *
   * @return configuration that bypasses the download cache
   */
  public SyncConfig withoutCache() {
    return new SyncConfig(cacheDir, cacheTtl, cacheEvictHours, workDir, outputDir, version, concurrency,
        maxRetries, retryDelay, requestTimeout, false, supportResume, userAgent, denylist, validateCidr,
        progressIntervalMillis, rulesetParallelism, compilerCommand, compiledDir, compilerTimeout, keepWorkFiles,
        only, dryRun);
  }

  private static int parseBoundedInt(Map<String, String> kv, String key, int defaultValue, int min, int max) {
    String raw = kv.get(key);
    if (raw == null || raw.isBlank()) {
      return defaultValue;
    }
    return Numbers.parseIntInRange(key, raw, min, max);
  }

  private static boolean parseBoolean(String name, String value, boolean fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    return switch (normalized) {
      case "true", "yes", "on", "1" -> true;
      case "false", "no", "off", "0" -> false;
      default -> throw new IllegalArgumentException(name + " must be true or false (was '" + value.trim() + "')");
    };
  }

  private static Path parsePath(String name, String value, Path fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    try {
      return Path.of(Strings.requireNonBlank(name, value)).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException(name + " is not a valid path: " + value, ex);
    }
  }

  private static String parseUserAgent(String value, String fallback) {
    if (value == null || value.isBlank()) {
      return fallback;
    }
    return Strings.requirePrintableAscii("userAgent", value, MAX_USER_AGENT_LENGTH);
  }

  static List<String> parseList(String value, List<String> fallback) {
    if (value == null) {
      return fallback;
    }
    List<String> items = new ArrayList<>();
    for (String token : value.split(",")) {
      String trimmed = token.trim();
      if (!trimmed.isEmpty()) {
        items.add(trimmed);
      }
    }
    return items;
  }
}
