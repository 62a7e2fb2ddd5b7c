package ca.gc.cra.rulesync.application.port;

import ca.gc.cra.rulesync.domain.fetch.CacheInfo;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Optional;

/**
 * <strong>What:</strong> Port over the URL-keyed on-disk payload cache.
 * <p><strong>Why:</strong> Rule sources change slowly; serving fresh copies from disk avoids re-downloading
 * dozens of lists on every run.</p>
 * <p><strong>Thread-safety:</strong> Implementations are shared by every download worker. A concurrent read of
 * an entry being written must observe either the previous entry or a miss, never a partial file.</p>
 *
 * @since 0.1.0
 */
public interface CachePort {
  /**
   * Returns a fresh, non-empty cache entry for {@code url}.
   *
   * @param url source location
   * @return entry path when valid; empty on miss, expiry, zero-byte or unreadable entries
   */
  Optional<Path> get(String url);

  /**
   * Stores a copy of {@code source} as the entry for {@code url}.
   *
   * @param url source location
   * @param source downloaded file to copy
   * @throws IOException when the copy cannot be written
   */
  void put(String url, Path source) throws IOException;

  /**
   * Removes entries older than {@code olderThanHours}, or all entries when absent.
   *
   * @param olderThanHours age threshold in hours; {@code null} removes everything
   * @return number of entries removed
   * @throws IOException when the cache directory cannot be listed
   */
  int evict(Integer olderThanHours) throws IOException;

  /**
   * Describes the current cache contents.
   *
   * @return cache snapshot
   * @throws IOException when the cache directory cannot be listed
   */
  CacheInfo info() throws IOException;
}
