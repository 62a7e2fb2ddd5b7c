package ca.gc.cra.rulesync.domain.fetch;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of retrieving one URL within a batch.
 *
 * @param url requested location
 * @param success whether a non-empty local copy is available
 * @param localPath local copy when successful
 * @param error last failure description when unsuccessful
 * @param sizeBytes size of the local copy; zero on failure
 * @param durationSeconds wall-clock time spent on the URL including retries
 * @param fromCache whether the copy was served from the on-disk cache
 * @since 0.1.0
 */
public record DownloadResult(
    String url,
    boolean success,
    Optional<Path> localPath,
    Optional<String> error,
    long sizeBytes,
    double durationSeconds,
    boolean fromCache) {

  private static final double BYTES_PER_MB = 1024d * 1024d;

  public DownloadResult {
    Objects.requireNonNull(url, "url");
    localPath = Objects.requireNonNullElse(localPath, Optional.empty());
    error = Objects.requireNonNullElse(error, Optional.empty());
    if (success && localPath.isEmpty()) {
      throw new IllegalArgumentException("successful result requires a local path");
    }
  }

  /**
   * Creates a successful result.
   *
   * @param url requested location
   * @param localPath local copy
   * @param sizeBytes copy size in bytes
   * @param durationSeconds elapsed seconds
   * @param fromCache whether the cache served the copy
   * @return successful result
   */
  public static DownloadResult success(
      String url, Path localPath, long sizeBytes, double durationSeconds, boolean fromCache) {
    return new DownloadResult(
        url, true, Optional.of(localPath), Optional.empty(), sizeBytes, durationSeconds, fromCache);
  }

  /**
   * Creates a failed result.
   *
   * @param url requested location
   * @param error failure description
   * @param durationSeconds elapsed seconds
   * @return failed result
   */
  public static DownloadResult failure(String url, String error, double durationSeconds) {
    return new DownloadResult(
        url, false, Optional.empty(), Optional.ofNullable(error), 0L, durationSeconds, false);
  }

  /**
   * Returns the effective transfer rate in MB/s, or zero when no time elapsed.
   *
   * @return megabytes per second
   */
  public double speedMbps() {
    if (durationSeconds <= 0d) {
      return 0d;
    }
    return (sizeBytes / BYTES_PER_MB) / durationSeconds;
  }
}
