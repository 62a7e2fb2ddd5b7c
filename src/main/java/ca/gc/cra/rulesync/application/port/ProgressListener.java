package ca.gc.cra.rulesync.application.port;

/**
 * <strong>What:</strong> Port receiving byte-level progress for a single transfer.
 * <p><strong>Why:</strong> The download coordinator aggregates per-file progress into batch snapshots without
 * the fetcher knowing about batches.</p>
 * <p><strong>Thread-safety:</strong> Invoked on the downloading thread after every chunk; implementations must
 * return quickly and tolerate concurrent calls from different workers.</p>
 *
 * @since 0.1.0
 * @see ca.gc.cra.rulesync.application.fetch.DownloadCoordinator
 */
@FunctionalInterface
public interface ProgressListener {
  /**
   * Reports transfer progress.
   *
   * @param downloadedBytes bytes present in the destination file, including resumed bytes
   * @param totalBytes expected total, or {@code -1} when unknown
   */
  void onProgress(long downloadedBytes, long totalBytes);

  /** Listener that ignores progress. */
  ProgressListener NONE = (downloaded, total) -> {};
}
