package ca.gc.cra.rulesync.domain.fetch;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.util.Objects;
import java.util.Optional;

/**
 * Snapshot of the on-disk cache.
 *
 * @param directory cache directory
 * @param fileCount number of cache entries
 * @param totalBytes combined entry size
 * @param oldest modification time of the oldest entry
 * @param newest modification time of the newest entry
 * @param ttl freshness window applied on reads
 */
public record CacheInfo(
    Path directory,
    int fileCount,
    long totalBytes,
    Optional<Instant> oldest,
    Optional<Instant> newest,
    Duration ttl) {

  public CacheInfo {
    Objects.requireNonNull(directory, "directory");
    oldest = Objects.requireNonNullElse(oldest, Optional.empty());
    newest = Objects.requireNonNullElse(newest, Optional.empty());
    Objects.requireNonNull(ttl, "ttl");
  }

  public double totalSizeMb() {
    return totalBytes / (1024d * 1024d);
  }
}
