package ca.gc.cra.rulesync.config;

import ca.gc.cra.rulesync.validation.Numbers;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Settings for the {@code cache} command.
 *
 * @param cacheDir cache directory to inspect or clear
 * @param cacheTtl freshness window reported by {@code cache info}
 * @param olderThanHours when present, {@code cache clear} only removes entries older than this
 * @since 0.1.0
 */
public record CacheConfig(Path cacheDir, Duration cacheTtl, Optional<Integer> olderThanHours) {
  private static final int MAX_HOURS = 24 * 365;

  public CacheConfig {
    Objects.requireNonNull(cacheDir, "cacheDir");
    Objects.requireNonNull(cacheTtl, "cacheTtl");
    olderThanHours = Objects.requireNonNullElse(olderThanHours, Optional.empty());
  }

  /**
   * Builds cache settings from flattened key/value pairs.
   *
   * @param args merged settings
   * @return validated settings
   * @throws IllegalArgumentException when a value is malformed
   */
  public static CacheConfig fromMap(Map<String, String> args) {
    Map<String, String> kv = args == null ? Map.of() : args;
    String dirRaw = kv.getOrDefault("cacheDir", SyncConfig.DEFAULT_CACHE_DIR);
    Path dir;
    try {
      dir = Path.of(dirRaw == null || dirRaw.isBlank() ? SyncConfig.DEFAULT_CACHE_DIR : dirRaw.trim()).normalize();
    } catch (InvalidPathException ex) {
      throw new IllegalArgumentException("cacheDir is not a valid path: " + dirRaw, ex);
    }
    String ttlRaw = kv.get("cacheTtlHours");
    int ttlHours = ttlRaw == null || ttlRaw.isBlank()
        ? SyncConfig.DEFAULT_CACHE_TTL_HOURS
        : Numbers.parseIntInRange("cacheTtlHours", ttlRaw, 1, MAX_HOURS);
    String olderRaw = kv.get("olderThanHours");
    Optional<Integer> older = olderRaw == null || olderRaw.isBlank()
        ? Optional.empty()
        : Optional.of(Numbers.parseIntInRange("olderThanHours", olderRaw, 0, MAX_HOURS));
    return new CacheConfig(dir, Duration.ofHours(ttlHours), older);
  }
}
